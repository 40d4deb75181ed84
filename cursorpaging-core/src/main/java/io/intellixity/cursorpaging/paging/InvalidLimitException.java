package io.intellixity.cursorpaging.paging;

public final class InvalidLimitException extends PaginationException {
  public InvalidLimitException(String message) {
    super(message);
  }

  public InvalidLimitException(String message, Throwable cause) {
    super(message, cause);
  }
}
