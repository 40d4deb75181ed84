package io.intellixity.cursorpaging.cursor;

import io.intellixity.cursorpaging.paging.CursorToken;
import io.intellixity.cursorpaging.paging.InvalidCursorException;
import io.intellixity.cursorpaging.paging.SortKeyTuple;
import io.intellixity.cursorpaging.paging.SortSpec;

/** Lossless mapping between a sort key and an opaque, text-safe token. Implementations are pure. */
public interface CursorCodec {
  /** Deterministic: the same tuple always yields the same token. */
  CursorToken encode(SortKeyTuple tuple);

  /**
   * Inverse of {@link #encode(SortKeyTuple)}.
   *
   * @throws InvalidCursorException if the token is malformed or does not match {@code sort}
   */
  SortKeyTuple decode(CursorToken token, SortSpec sort);
}
