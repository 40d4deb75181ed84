package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.query.QueryElement;

import java.util.List;

/**
 * Execution collaborator (the database driver side). Backends implement it; failures are
 * thrown as-is and wrapped by {@link Paginator}.
 *
 * @param <R> raw row type returned by the backend
 */
public interface PageExecutor<R> {
  /** Rows matching {@code query.filter()}, ordered per {@code query.sort()}, at most {@code query.limit()} of them. */
  List<R> executeFind(PageQuery query);

  /** Number of rows matching {@code filter} (null matches everything), ignoring any paging. */
  long executeCount(QueryElement filter);
}
