package io.intellixity.cursorpaging.mongo;

import io.intellixity.cursorpaging.exec.PageQuery;
import io.intellixity.cursorpaging.query.QueryElement;
import io.intellixity.cursorpaging.query.SortField;
import org.bson.Document;

import java.util.List;
import java.util.Objects;

/** Mongo dialect: renders backend-agnostic page queries to find/count statements. */
public final class MongoPageDialect {

  public MongoPageStatement find(String collection, PageQuery query) {
    Objects.requireNonNull(query, "query");
    return new MongoPageStatement(MongoPageStatement.Kind.FIND, requireCollection(collection),
        MongoQueryRenderer.toBson(query.filter()), sortDoc(query.sort()), query.skip(), query.limit());
  }

  public MongoPageStatement count(String collection, QueryElement filter) {
    return new MongoPageStatement(MongoPageStatement.Kind.COUNT, requireCollection(collection),
        MongoQueryRenderer.toBson(filter), null, null, null);
  }

  // ---- helpers ----

  private static String requireCollection(String c) {
    if (c == null || c.isBlank()) throw new IllegalArgumentException("collection name is required");
    return c;
  }

  /** Keys in sort precedence order; Document keeps insertion order. */
  static Document sortDoc(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) {
      d.put(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return d;
  }
}
