package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.query.QueryElement;
import io.intellixity.cursorpaging.query.SortField;

import java.util.List;
import java.util.Objects;

/**
 * Concrete find instructions for the execution collaborator.
 *
 * @param filter base filter combined with the cursor seek predicate; null matches everything
 * @param sort order to scan in (already reversed for a backwards page)
 * @param limit rows to fetch, one more than the page size
 * @param skip rows to skip first; null outside offset mode
 */
public record PageQuery(QueryElement filter, List<SortField> sort, int limit, Integer skip) {
  public PageQuery {
    sort = List.copyOf(Objects.requireNonNull(sort, "sort"));
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
  }
}
