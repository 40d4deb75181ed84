package io.intellixity.cursorpaging.paging;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One page of results. {@code items} are in the same order as {@code edges}, always ascending per the
 * request's sort spec. {@code totalCount} is null when the count was not requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FindResult<T>(PageInfo pageInfo, List<Edge<T>> edges, List<T> items, Long totalCount) {
  public FindResult {
    Objects.requireNonNull(pageInfo, "pageInfo");
    edges = List.copyOf(edges == null ? List.of() : edges);
    items = Collections.unmodifiableList(new ArrayList<>(items == null ? List.of() : items));
    if (edges.size() != items.size()) {
      throw new IllegalArgumentException("edges/items size mismatch: " + edges.size() + " != " + items.size());
    }
  }

  public boolean isEmpty() { return items.isEmpty(); }
}
