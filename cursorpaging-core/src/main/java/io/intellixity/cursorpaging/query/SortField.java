package io.intellixity.cursorpaging.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public SortField reversed() {
    return new SortField(field, direction == Direction.ASC ? Direction.DESC : Direction.ASC);
  }

  public enum Direction { ASC, DESC }
}
