package io.intellixity.cursorpaging.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE;

  /** Strict comparison operator that moves past {@code value} in the given sort direction. */
  public static Operator seek(SortField.Direction direction) {
    return (direction == SortField.Direction.DESC) ? LT : GT;
  }
}
