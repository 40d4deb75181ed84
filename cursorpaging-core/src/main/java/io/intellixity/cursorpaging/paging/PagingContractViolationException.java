package io.intellixity.cursorpaging.paging;

/**
 * An internal invariant was broken (e.g. the executor returned more rows than requested).
 * Not a {@link PaginationException}: the request must abort instead of returning a partial page.
 */
public final class PagingContractViolationException extends IllegalStateException {
  public PagingContractViolationException(String message) {
    super(message);
  }
}
