package io.intellixity.cursorpaging.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import io.intellixity.cursorpaging.exec.Paginator;
import io.intellixity.cursorpaging.paging.*;
import io.intellixity.cursorpaging.query.SortField;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.intellixity.cursorpaging.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class MongoPaginationTest {
  private static final SortSpec SCORE_ID = SortSpec.of(SortField.desc("score"), SortField.asc("_id"));
  private static final int[] SCORES = {50, 40, 40, 30, 20, 20, 10};

  private MongoServer server;
  private MongoClient client;
  private MongoCollection<Document> items;

  @BeforeEach
  void start() {
    server = new MongoServer(new MemoryBackend());
    client = MongoClients.create(server.bindAndGetConnectionString());
    items = client.getDatabase("paging").getCollection("items");

    List<Document> docs = new ArrayList<>();
    for (int i = 0; i < SCORES.length; i++) {
      int id = i + 1;
      docs.add(new Document("_id", id)
          .append("name", "item-" + id)
          .append("score", SCORES[i])
          .append("status", id % 2 == 1 ? "OPEN" : "CLOSED")
          .append("meta", new Document("rank", 8 - id)));
    }
    items.insertMany(docs);
  }

  @AfterEach
  void stop() {
    client.close();
    server.shutdownNow();
  }

  private static List<Object> ids(FindResult<Document> r) {
    List<Object> out = new ArrayList<>();
    for (Document d : r.items()) out.add(d.get("_id"));
    return out;
  }

  @Test
  void forwardWalk_visitsEveryDocumentOnce() {
    Paginator<Document, Document> p = MongoPagination.documents(items);

    FindResult<Document> page = p.paginate(PaginationRequest.first(SCORE_ID, 3));
    assertEquals(List.of(1, 2, 3), ids(page));
    assertTrue(page.pageInfo().hasNextPage());
    assertFalse(page.pageInfo().hasPreviousPage());
    assertEquals(7L, page.totalCount());

    page = p.paginate(PaginationRequest.after(SCORE_ID, page.pageInfo().nextCursor(), 3));
    assertEquals(List.of(4, 5, 6), ids(page));
    assertTrue(page.pageInfo().hasNextPage());
    assertTrue(page.pageInfo().hasPreviousPage());
    assertEquals(7L, page.totalCount());

    page = p.paginate(PaginationRequest.after(SCORE_ID, page.pageInfo().nextCursor(), 3));
    assertEquals(List.of(7), ids(page));
    assertFalse(page.pageInfo().hasNextPage());
    assertTrue(page.pageInfo().hasPreviousPage());
  }

  @Test
  void backwardWalk_returnsPagesInSortOrder() {
    Paginator<Document, Document> p = MongoPagination.documents(items);
    FindResult<Document> last = p.paginate(PaginationRequest.offset(SCORE_ID, 6, 3));
    assertEquals(List.of(7), ids(last));

    FindResult<Document> back = p.paginate(PaginationRequest.before(SCORE_ID, last.pageInfo().startCursor(), 3));
    assertEquals(List.of(4, 5, 6), ids(back));
    assertTrue(back.pageInfo().hasPreviousPage());
    assertTrue(back.pageInfo().hasNextPage());

    back = p.paginate(PaginationRequest.before(SCORE_ID, back.pageInfo().startCursor(), 3));
    assertEquals(List.of(1, 2, 3), ids(back));
    assertFalse(back.pageInfo().hasPreviousPage());
  }

  @Test
  void offsetPaging() {
    FindResult<Document> r = MongoPagination.documents(items).paginate(PaginationRequest.offset(SCORE_ID, 2, 2));

    assertEquals(List.of(3, 4), ids(r));
    assertTrue(r.pageInfo().hasPreviousPage());
    assertTrue(r.pageInfo().hasNextPage());
  }

  @Test
  void findPaginated_combinesFilters() {
    PaginationRequest request = PaginationRequest.builder().sort(SCORE_ID).limit(2).build();

    FindResult<Document> r = MongoPagination.findPaginated(items, eq("status", "OPEN"), request);
    assertEquals(List.of(1, 3), ids(r));
    assertEquals(4L, r.totalCount());
    assertTrue(r.pageInfo().hasNextPage());

    FindResult<Document> next = MongoPagination.findPaginated(items, eq("status", "OPEN"),
        request.toBuilder().cursor(r.pageInfo().nextCursor()).build());
    assertEquals(List.of(5, 7), ids(next));
    assertEquals(4L, next.totalCount());
    assertFalse(next.pageInfo().hasNextPage());
  }

  @Test
  void embeddedSortField() {
    SortSpec byRank = SortSpec.of(SortField.asc("meta.rank"));
    Paginator<Document, String> p = MongoPagination.mapped(items, d -> d.getString("name"));

    FindResult<String> first = p.paginate(PaginationRequest.first(byRank, 2));
    assertEquals(List.of("item-7", "item-6"), first.items());

    FindResult<String> second = p.paginate(PaginationRequest.after(byRank, first.pageInfo().nextCursor(), 2));
    assertEquals(List.of("item-5", "item-4"), second.items());
  }

  @Test
  void cursorFromAnotherSortIsRejected() {
    Paginator<Document, Document> p = MongoPagination.documents(items);
    CursorToken byRank = p.paginate(PaginationRequest.first(SortSpec.of(SortField.asc("meta.rank")), 2)).pageInfo().nextCursor();

    assertThrows(InvalidCursorException.class, () -> p.paginate(PaginationRequest.after(SCORE_ID, byRank, 2)));
  }

  @Test
  void countCanBeSkipped() {
    PaginationRequest r = PaginationRequest.builder().sort(SCORE_ID).limit(2).includeTotalCount(false).build();
    assertNull(MongoPagination.documents(items).paginate(r).totalCount());
  }

  @Test
  void driverFailureIsWrapped() {
    Paginator<Document, Document> p = MongoPagination.documents(items);
    client.close();

    ExecutionFailureException ex = assertThrows(ExecutionFailureException.class,
        () -> p.paginate(PaginationRequest.first(SCORE_ID, 2)));
    assertEquals("find", ex.operation());
  }

  @Test
  void sessionIsRequiredWhenBinding() {
    MongoPageExecutor executor = new MongoPageExecutor(items);

    assertEquals("items", executor.collectionName());
    assertThrows(NullPointerException.class, () -> executor.withSession(null));
  }

  @Test
  void findOptionsApplyToFindAndCount() {
    MongoPageExecutor executor = new MongoPageExecutor(items)
        .withOptions(MongoFindOptions.NONE.withMaxTime(Duration.ofSeconds(5)));
    Paginator<Document, Document> p = MongoPagination.mapped(executor, d -> d, PagingSettings.defaults());

    FindResult<Document> page = p.paginate(PaginationRequest.first(SCORE_ID, 4));
    assertEquals(List.of(1, 2, 3, 4), ids(page));
    assertEquals(7L, page.totalCount());
    assertEquals(Duration.ofSeconds(5), executor.options().maxTime());
  }

  @Test
  void documentsWithoutTheSortFieldStayReachable() {
    MongoCollection<Document> sparse = client.getDatabase("paging").getCollection("sparse");
    sparse.insertMany(List.of(
        new Document("_id", 1),
        new Document("_id", 2).append("score", 5),
        new Document("_id", 3).append("score", 7),
        new Document("_id", 4).append("score", null)));
    Paginator<Document, Document> p = MongoPagination.documents(sparse);
    SortSpec asc = SortSpec.of(SortField.asc("score"), SortField.asc("_id"));
    SortSpec desc = SortSpec.of(SortField.desc("score"), SortField.asc("_id"));

    FindResult<Document> first = p.paginate(PaginationRequest.first(asc, 1));
    assertEquals(List.of(1), ids(first));
    assertTrue(first.pageInfo().hasNextPage());
    FindResult<Document> second = p.paginate(PaginationRequest.after(asc, first.pageInfo().nextCursor(), 1));
    assertEquals(List.of(4), ids(second));

    assertEquals(List.of(1, 4, 2, 3), walkForward(p, asc, 1));
    assertEquals(List.of(3, 2, 1, 4), walkForward(p, desc, 2));

    FindResult<Document> back = p.paginate(PaginationRequest.before(asc, first.pageInfo().nextCursor(), 1));
    assertTrue(back.isEmpty());
    assertFalse(back.pageInfo().hasPreviousPage());

    back = p.paginate(PaginationRequest.before(asc, second.pageInfo().nextCursor(), 1));
    assertEquals(List.of(1), ids(back));
  }

  private static List<Object> walkForward(Paginator<Document, Document> p, SortSpec spec, int limit) {
    FindResult<Document> page = p.paginate(PaginationRequest.first(spec, limit));
    List<Object> seen = new ArrayList<>(ids(page));
    while (page.pageInfo().hasNextPage()) {
      page = p.paginate(PaginationRequest.after(spec, page.pageInfo().nextCursor(), limit));
      seen.addAll(ids(page));
    }
    return seen;
  }
}
