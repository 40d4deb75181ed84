package io.intellixity.cursorpaging.paging;

/** Token is not valid base64url, not a valid BSON document, or does not match the active sort. */
public final class InvalidCursorException extends PaginationException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(message, cause);
  }
}
