package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.cursor.CursorCodec;
import io.intellixity.cursorpaging.paging.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds a {@link FindResult} from the rows fetched for a {@link PageQuery}.
 *
 * A full fetch ({@code limit + 1} rows) means another page exists in the travel direction; the extra row
 * is dropped. Backwards pages are re-reversed so callers always see rows in sort order.
 *
 * @param <R> raw row type
 * @param <T> item type handed to the caller
 */
public final class PageAssembler<R, T> {
  private final CursorCodec codec;
  private final FieldReader<R> fields;
  private final Function<R, T> mapper;

  public PageAssembler(CursorCodec codec, FieldReader<R> fields, Function<R, T> mapper) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.fields = Objects.requireNonNull(fields, "fields");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public FindResult<T> assemble(PaginationRequest request, List<R> rows, Long totalCount) {
    Objects.requireNonNull(request, "request");
    if (rows == null) throw new PagingContractViolationException("executor returned null rows");

    int limit = request.limit();
    int fetched = rows.size();
    if (fetched > limit + 1) {
      throw new PagingContractViolationException(
          "executor returned " + fetched + " rows but at most " + (limit + 1) + " were requested");
    }

    boolean hasMore = fetched == limit + 1;
    List<R> page = new ArrayList<>(hasMore ? rows.subList(0, limit) : rows);
    if (request.direction() == Direction.PREVIOUS && request.mode() instanceof PagingMode.Cursor) {
      Collections.reverse(page);
    }

    SortSpec sort = request.sortSpec();
    List<Edge<T>> edges = new ArrayList<>(page.size());
    List<T> items = new ArrayList<>(page.size());
    for (R row : page) {
      SortKeyTuple key = SortKeyTuple.project(sort, f -> fields.read(row, f));
      T item = mapper.apply(row);
      edges.add(new Edge<>(cursorFor(key), item));
      items.add(item);
    }

    CursorToken start = edges.isEmpty() ? null : edges.get(0).cursor();
    CursorToken next = edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor();
    PageInfo info = pageInfo(request.mode(), hasMore, start, next);
    return new FindResult<>(info, edges, items, request.includeTotalCount() ? totalCount : null);
  }

  private CursorToken cursorFor(SortKeyTuple key) {
    try {
      return codec.encode(key);
    } catch (IllegalArgumentException e) {
      throw new InvalidSortSpecException("Sort fields " + key.fields() + " cannot back a cursor: " + e.getMessage(), e);
    }
  }

  private static PageInfo pageInfo(PagingMode mode, boolean hasMore, CursorToken start, CursorToken next) {
    if (mode instanceof PagingMode.Offset o) {
      return new PageInfo(hasMore, o.skip() > 0, start, next);
    }
    if (mode instanceof PagingMode.Cursor c) {
      // a cursor was supplied, so the page we came from lies behind us
      return (c.direction() == Direction.PREVIOUS)
          ? new PageInfo(true, hasMore, start, next)
          : new PageInfo(hasMore, true, start, next);
    }
    return new PageInfo(hasMore, false, start, next);
  }
}
