package io.intellixity.cursorpaging.paging;

public final class InvalidSortSpecException extends PaginationException {
  public InvalidSortSpecException(String message) {
    super(message);
  }

  public InvalidSortSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
