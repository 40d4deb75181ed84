package io.intellixity.cursorpaging.paging;

import java.util.*;
import java.util.function.Function;

/**
 * The sort-key values of one row, in {@link SortSpec} order. Values may be null.
 */
public record SortKeyTuple(List<String> fields, List<Object> values) {
  public SortKeyTuple {
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(values, "values");
    if (fields.size() != values.size()) {
      throw new IllegalArgumentException("fields/values size mismatch: " + fields.size() + " != " + values.size());
    }
    fields = List.copyOf(fields);
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /** Projects the spec's fields out of a row through {@code reader}. */
  public static SortKeyTuple project(SortSpec spec, Function<String, Object> reader) {
    List<String> names = spec.fieldNames();
    List<Object> values = new ArrayList<>(names.size());
    for (String n : names) values.add(reader.apply(n));
    return new SortKeyTuple(names, values);
  }

  public int size() { return fields.size(); }

  public Object value(int index) { return values.get(index); }

  public Object value(String field) {
    int i = fields.indexOf(field);
    if (i < 0) throw new IllegalArgumentException("No sort key value for field: " + field);
    return values.get(i);
  }
}
