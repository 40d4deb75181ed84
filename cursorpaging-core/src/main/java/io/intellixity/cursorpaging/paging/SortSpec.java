package io.intellixity.cursorpaging.paging;

import io.intellixity.cursorpaging.query.SortField;

import java.util.*;

/**
 * Ordered, non-empty list of sort fields defining a total order over results.
 *
 * <p>Field order is tie-break precedence. Cursors are only deterministic when the last field is unique
 * per row (e.g. {@code _id}); that is the caller's responsibility, see {@link #withTieBreaker(String)}.</p>
 */
public final class SortSpec {
  private final List<SortField> fields;

  private SortSpec(List<SortField> fields) {
    if (fields == null || fields.isEmpty()) throw new InvalidSortSpecException("sort spec must not be empty");
    Set<String> seen = new HashSet<>();
    for (SortField f : fields) {
      if (f == null) throw new InvalidSortSpecException("sort spec contains a null field");
      if (f.field().isBlank()) throw new InvalidSortSpecException("sort field name must not be blank");
      if (!seen.add(f.field())) throw new InvalidSortSpecException("duplicate sort field: " + f.field());
    }
    this.fields = List.copyOf(fields);
  }

  public static SortSpec of(List<SortField> fields) { return new SortSpec(fields); }

  public static SortSpec of(SortField... fields) { return new SortSpec(fields == null ? null : Arrays.asList(fields)); }

  public List<SortField> fields() { return fields; }

  public int size() { return fields.size(); }

  public List<String> fieldNames() {
    List<String> out = new ArrayList<>(fields.size());
    for (SortField f : fields) out.add(f.field());
    return out;
  }

  public boolean contains(String field) {
    for (SortField f : fields) if (f.field().equals(field)) return true;
    return false;
  }

  /** Same fields, every direction flipped. Scanning this order walks the index backwards. */
  public SortSpec reversed() {
    List<SortField> out = new ArrayList<>(fields.size());
    for (SortField f : fields) out.add(f.reversed());
    return new SortSpec(out);
  }

  /** Appends {@code field ASC} unless the spec already sorts on it. */
  public SortSpec withTieBreaker(String field) {
    if (field == null || field.isBlank() || contains(field)) return this;
    List<SortField> out = new ArrayList<>(fields);
    out.add(SortField.asc(field));
    return new SortSpec(out);
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof SortSpec s) && fields.equals(s.fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "SortSpec" + fields; }
}
