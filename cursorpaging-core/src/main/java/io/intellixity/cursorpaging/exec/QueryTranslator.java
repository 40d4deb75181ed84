package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.cursor.CursorCodec;
import io.intellixity.cursorpaging.paging.*;
import io.intellixity.cursorpaging.query.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link PaginationRequest} into a {@link PageQuery}.
 *
 * Cursor mode builds a lexicographic seek predicate over the sort fields:
 * {@code (f1 op1 v1) OR (f1 = v1 AND f2 op2 v2) OR ...}, where each op moves past the cursor
 * in the travel direction. Backwards pages also scan in fully reversed sort order. A null cursor value
 * is ordered before every other value, so a cursor issued for a row with a missing sort field stays resumable.
 * Every mode fetches {@code limit + 1} rows so the assembler can tell whether more rows exist.
 */
public final class QueryTranslator {
  private final CursorCodec codec;

  public QueryTranslator(CursorCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public PageQuery translate(PaginationRequest request) {
    Objects.requireNonNull(request, "request");
    SortSpec sort = request.sortSpec();
    if (sort == null) throw new InvalidSortSpecException("sort spec is required");
    int fetch = fetchLimit(request.limit());

    PagingMode mode = request.mode();
    if (mode instanceof PagingMode.Offset o) {
      return new PageQuery(request.filter(), sort.fields(), fetch, o.skip());
    }
    if (mode instanceof PagingMode.Cursor c) {
      SortKeyTuple key = codec.decode(c.token(), sort);
      boolean backwards = c.direction() == Direction.PREVIOUS;
      SortSpec scan = backwards ? sort.reversed() : sort;
      QueryElement filter = QueryFilters.allOf(request.filter(), seekPredicate(scan, key));
      return new PageQuery(filter, scan.fields(), fetch, null);
    }
    return new PageQuery(request.filter(), sort.fields(), fetch, null);
  }

  static int fetchLimit(int limit) {
    if (limit <= 0) throw new InvalidLimitException("limit must be > 0 but was " + limit);
    if (limit == Integer.MAX_VALUE) throw new InvalidLimitException("limit too large: " + limit);
    return limit + 1;
  }

  /**
   * Rows strictly after {@code key} when scanning in {@code scan} order.
   * Null and missing values sort before every other value, as in MongoDB.
   */
  static QueryElement seekPredicate(SortSpec scan, SortKeyTuple key) {
    List<SortField> fields = scan.fields();
    List<QueryElement> orTerms = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      SortField sf = fields.get(i);
      QueryElement past = strictlyPast(sf.field(), Operator.seek(sf.direction()), key.value(sf.field()));
      if (past == null) continue;

      List<QueryElement> andTerms = new ArrayList<>(i + 1);
      // equalities for 0..i-1
      for (int j = 0; j < i; j++) {
        String f = fields.get(j).field();
        andTerms.add(QueryFilters.eq(f, key.value(f)));
      }
      andTerms.add(past);
      if (andTerms.size() > 1) {
        orTerms.add(new LogicalGroup(Clause.AND, andTerms));
      } else if (past instanceof LogicalGroup g && g.clause() == Clause.OR) {
        orTerms.addAll(g.elements());
      } else {
        orTerms.add(past);
      }
    }
    // key sits at the very end of the scan: match no row
    if (orTerms.isEmpty()) return QueryFilters.in(fields.get(fields.size() - 1).field(), List.of());
    return orTerms.size() == 1 ? orTerms.get(0) : new LogicalGroup(Clause.OR, orTerms);
  }

  /** Strict comparison past {@code value}; null when no value sorts past it. */
  static QueryElement strictlyPast(String field, Operator op, Object value) {
    if (value == null) return (op == Operator.GT) ? QueryFilters.ne(field, null) : null;
    if (op == Operator.LT) return QueryFilters.or(QueryFilters.lt(field, value), QueryFilters.eq(field, null));
    return Condition.of(field, op, value);
  }
}
