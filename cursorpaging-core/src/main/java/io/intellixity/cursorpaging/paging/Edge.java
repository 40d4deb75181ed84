package io.intellixity.cursorpaging.paging;

import java.util.Objects;

/** A returned item paired with its own cursor; every edge can be resumed from. */
public record Edge<T>(CursorToken cursor, T node) {
  public Edge {
    Objects.requireNonNull(cursor, "cursor");
  }
}
