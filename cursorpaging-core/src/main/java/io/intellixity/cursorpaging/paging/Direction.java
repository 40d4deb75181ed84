package io.intellixity.cursorpaging.paging;

/** Travel direction relative to the sort order when resuming from a cursor. */
public enum Direction {
  NEXT,
  PREVIOUS
}
