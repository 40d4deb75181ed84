package io.intellixity.cursorpaging.query;

/**
 * Raised when a filter tree is malformed for rendering (missing operand, unsupported node).
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
