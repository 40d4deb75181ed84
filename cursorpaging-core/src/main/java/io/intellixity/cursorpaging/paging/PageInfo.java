package io.intellixity.cursorpaging.paging;

/**
 * Page metadata. {@code nextCursor} is the token to pass with {@link Direction#NEXT} for the following page,
 * {@code startCursor} the one to pass with {@link Direction#PREVIOUS}. Both are absent on an empty page.
 */
public record PageInfo(boolean hasNextPage,
                       boolean hasPreviousPage,
                       CursorToken startCursor,
                       CursorToken nextCursor) {
}
