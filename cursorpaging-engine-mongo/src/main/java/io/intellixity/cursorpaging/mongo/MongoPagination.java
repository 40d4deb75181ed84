package io.intellixity.cursorpaging.mongo;

import com.mongodb.client.MongoCollection;
import io.intellixity.cursorpaging.cursor.BsonCursorCodec;
import io.intellixity.cursorpaging.exec.Paginator;
import io.intellixity.cursorpaging.paging.FindResult;
import io.intellixity.cursorpaging.paging.PaginationRequest;
import io.intellixity.cursorpaging.paging.PagingSettings;
import io.intellixity.cursorpaging.query.QueryElement;
import org.bson.Document;

import java.util.function.Function;

import static io.intellixity.cursorpaging.query.QueryFilters.allOf;

/** Ready-made paginators over a Mongo collection. Settings come from {@link PagingSettings#load()}. */
public final class MongoPagination {
  private MongoPagination() {}

  public static Paginator<Document, Document> documents(MongoCollection<Document> collection) {
    return mapped(collection, Function.identity());
  }

  public static <T> Paginator<Document, T> mapped(MongoCollection<Document> collection, Function<Document, T> mapper) {
    return mapped(new MongoPageExecutor(collection), mapper, PagingSettings.load());
  }

  public static <T> Paginator<Document, T> mapped(MongoPageExecutor executor,
                                                  Function<Document, T> mapper,
                                                  PagingSettings settings) {
    return new Paginator<>(executor, MongoDocumentFields.INSTANCE, mapper, new BsonCursorCodec(), settings);
  }

  /** One-shot: paginate {@code collection} with {@code filter} ANDed onto the request's own filter. */
  public static FindResult<Document> findPaginated(MongoCollection<Document> collection,
                                                   QueryElement filter,
                                                   PaginationRequest request) {
    PaginationRequest effective = (filter == null) ? request : request.withFilter(allOf(filter, request.filter()));
    return documents(collection).paginate(effective);
  }
}
