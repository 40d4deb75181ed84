package io.intellixity.cursorpaging.paging;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.cursorpaging.query.QueryElement;
import io.intellixity.cursorpaging.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Immutable pagination request. The {@link PagingMode} is resolved once by {@link Builder#build()}:
 *
 * <ul>
 *   <li>skip &gt; 0: offset mode, any cursor is ignored</li>
 *   <li>explicit skip of 0 and no cursor: offset mode (page-based paging)</li>
 *   <li>cursor present: cursor mode, direction defaults to {@link Direction#NEXT}</li>
 *   <li>otherwise: first page</li>
 * </ul>
 */
@JsonSerialize(using = PaginationRequestJsonSerializer.class)
@JsonDeserialize(using = PaginationRequestJsonDeserializer.class)
public final class PaginationRequest {
  private static final Logger log = LoggerFactory.getLogger(PaginationRequest.class);

  private final SortSpec sortSpec;
  private final PagingMode mode;
  private final int limit;
  private final QueryElement filter;
  private final boolean includeTotalCount;

  private PaginationRequest(SortSpec sortSpec, PagingMode mode, int limit, QueryElement filter, boolean includeTotalCount) {
    this.sortSpec = sortSpec;
    this.mode = mode;
    this.limit = limit;
    this.filter = filter;
    this.includeTotalCount = includeTotalCount;
  }

  public SortSpec sortSpec() { return sortSpec; }
  public PagingMode mode() { return mode; }
  public int limit() { return limit; }
  /** Caller's base filter, or null for "match all". */
  public QueryElement filter() { return filter; }
  public boolean includeTotalCount() { return includeTotalCount; }

  /** Direction of a cursor request; {@link Direction#NEXT} for every other mode. */
  public Direction direction() {
    return (mode instanceof PagingMode.Cursor c) ? c.direction() : Direction.NEXT;
  }

  public static Builder builder() { return new Builder(); }

  public static PaginationRequest first(SortSpec sort, int limit) {
    return builder().sort(sort).limit(limit).build();
  }

  public static PaginationRequest after(SortSpec sort, CursorToken cursor, int limit) {
    return builder().sort(sort).cursor(cursor).direction(Direction.NEXT).limit(limit).build();
  }

  public static PaginationRequest before(SortSpec sort, CursorToken cursor, int limit) {
    return builder().sort(sort).cursor(cursor).direction(Direction.PREVIOUS).limit(limit).build();
  }

  public static PaginationRequest offset(SortSpec sort, int skip, int limit) {
    return builder().sort(sort).skip(skip).limit(limit).build();
  }

  /** Builder carrying this request's sort, limit, filter and count flag, with no cursor or skip. */
  public Builder toBuilder() {
    return builder().sort(sortSpec).limit(limit).filter(filter).includeTotalCount(includeTotalCount);
  }

  /** Same sort, mode and limit with {@code filter} as the base filter. */
  public PaginationRequest withFilter(QueryElement filter) {
    return new PaginationRequest(sortSpec, mode, limit, filter, includeTotalCount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PaginationRequest r)) return false;
    return limit == r.limit
        && includeTotalCount == r.includeTotalCount
        && sortSpec.equals(r.sortSpec)
        && mode.equals(r.mode)
        && Objects.equals(filter, r.filter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sortSpec, mode, limit, filter, includeTotalCount);
  }

  @Override
  public String toString() {
    return "PaginationRequest{sort=" + sortSpec + ", mode=" + mode.getClass().getSimpleName()
        + ", direction=" + direction() + ", limit=" + limit + ", filtered=" + (filter != null)
        + ", totalCount=" + includeTotalCount + "}";
  }

  public static final class Builder {
    private SortSpec sort;
    private int limit = PagingSettings.DEFAULT_LIMIT;
    private Integer skip;
    private CursorToken cursor;
    private Direction direction;
    private QueryElement filter;
    private boolean includeTotalCount = true;
    private String tieBreaker;

    private Builder() {}

    public Builder sort(SortSpec sort) { this.sort = sort; return this; }
    public Builder sort(SortField... fields) { this.sort = SortSpec.of(fields); return this; }
    public Builder limit(int limit) { this.limit = limit; return this; }
    public Builder skip(Integer skip) { this.skip = skip; return this; }
    public Builder cursor(CursorToken cursor) { this.cursor = cursor; return this; }
    public Builder cursor(String cursor) { this.cursor = (cursor == null || cursor.isEmpty()) ? null : CursorToken.of(cursor); return this; }
    public Builder direction(Direction direction) { this.direction = direction; return this; }
    public Builder filter(QueryElement filter) { this.filter = filter; return this; }
    public Builder includeTotalCount(boolean includeTotalCount) { this.includeTotalCount = includeTotalCount; return this; }
    /** Field appended as the last ascending sort key when the sort does not already contain it. */
    public Builder tieBreaker(String field) { this.tieBreaker = field; return this; }

    public PaginationRequest build() {
      if (sort == null) throw new InvalidSortSpecException("sort spec is required");
      if (limit <= 0) throw new InvalidLimitException("limit must be > 0 but was " + limit);
      if (skip != null && skip < 0) throw new InvalidLimitException("skip must be >= 0 but was " + skip);

      SortSpec effectiveSort = sort.withTieBreaker(tieBreaker);
      return new PaginationRequest(effectiveSort, resolveMode(), limit, filter, includeTotalCount);
    }

    private PagingMode resolveMode() {
      if (skip != null && skip > 0) {
        if (cursor != null) log.debug("cursorpaging.request cursor ignored in offset mode skip={}", skip);
        return new PagingMode.Offset(skip);
      }
      if (cursor != null) return new PagingMode.Cursor(cursor, direction);
      if (skip != null) return new PagingMode.Offset(0);
      return new PagingMode.First();
    }
  }
}
