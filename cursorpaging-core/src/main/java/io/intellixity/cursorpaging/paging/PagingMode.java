package io.intellixity.cursorpaging.paging;

import java.util.Objects;

/**
 * How a request pages, decided once when the {@link PaginationRequest} is built.
 */
public sealed interface PagingMode {

  /** No cursor, no offset: the first page in sort order. */
  record First() implements PagingMode {}

  /** Classic skip/limit paging. Any cursor on the request was dropped. */
  record Offset(int skip) implements PagingMode {
    public Offset {
      if (skip < 0) throw new InvalidLimitException("skip must be >= 0");
    }
  }

  /** Resume strictly after ({@link Direction#NEXT}) or before ({@link Direction#PREVIOUS}) the cursor row. */
  record Cursor(CursorToken token, Direction direction) implements PagingMode {
    public Cursor {
      Objects.requireNonNull(token, "token");
      direction = (direction == null) ? Direction.NEXT : direction;
    }
  }
}
