package io.intellixity.cursorpaging.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return Condition.of(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return Condition.of(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return Condition.of(property, Operator.LE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, values); }
  public static Condition nin(String property, Collection<?> values) { return Condition.of(property, Operator.NIN, values); }

  public static Condition range(String property, Object lower, Object upper) { return Condition.range(property, lower, upper); }

  /** SQL-style pattern: '%' matches any run of characters, '_' a single character. */
  public static Condition like(String property, Object value) { return Condition.of(property, Operator.LIKE, value); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  /** AND of the non-null arguments; returns the single remaining element unwrapped. */
  public static QueryElement allOf(QueryElement a, QueryElement b) {
    if (a == null) return b;
    if (b == null) return a;
    return and(a, b);
  }
}
