package io.intellixity.cursorpaging.paging;

/**
 * Base type for recoverable pagination failures surfaced to the caller.
 * <p>
 * Caller input errors ({@link InvalidSortSpecException}, {@link InvalidCursorException},
 * {@link InvalidLimitException}) and environment errors ({@link ExecutionFailureException}) extend it.
 * Broken internal invariants are reported with {@link PagingContractViolationException} instead.
 */
public abstract class PaginationException extends RuntimeException {
  protected PaginationException(String message) {
    super(message);
  }

  protected PaginationException(String message, Throwable cause) {
    super(message, cause);
  }
}
