package io.intellixity.cursorpaging.paging;

/** Wraps a driver/transport failure raised while running the find or count of a page. */
public final class ExecutionFailureException extends PaginationException {
  private final String operation;

  public ExecutionFailureException(String operation, Throwable cause) {
    super("Pagination " + operation + " failed: " + cause.getMessage(), cause);
    this.operation = operation;
  }

  /** "find" or "count". */
  public String operation() { return operation; }
}
