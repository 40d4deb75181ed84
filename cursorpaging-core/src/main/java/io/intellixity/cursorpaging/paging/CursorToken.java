package io.intellixity.cursorpaging.paging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Opaque resume position handed back to callers. Serializes as a bare string.
 * Two tokens are equal iff they decode to the same sort key.
 */
public record CursorToken(String value) {
  public CursorToken {
    Objects.requireNonNull(value, "value");
    if (value.isEmpty()) throw new InvalidCursorException("cursor must not be empty");
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static CursorToken of(String value) {
    return new CursorToken(value);
  }

  @JsonValue
  @Override
  public String value() { return value; }

  @Override
  public String toString() { return value; }
}
