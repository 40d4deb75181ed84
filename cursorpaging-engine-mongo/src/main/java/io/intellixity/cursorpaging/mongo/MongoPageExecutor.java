package io.intellixity.cursorpaging.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import io.intellixity.cursorpaging.exec.PageExecutor;
import io.intellixity.cursorpaging.exec.PageQuery;
import io.intellixity.cursorpaging.query.QueryElement;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Page executor over a collection using the official MongoDB Java sync driver.
 * When bound to a {@link ClientSession}, reads run inside that session (and its transaction, if any).
 */
public final class MongoPageExecutor implements PageExecutor<Document> {
  private static final Logger log = LoggerFactory.getLogger(MongoPageExecutor.class);

  private final MongoCollection<Document> collection;
  private final ClientSession session;
  private final MongoPageDialect dialect;
  private final MongoFindOptions options;

  public MongoPageExecutor(MongoCollection<Document> collection) {
    this(collection, null, new MongoPageDialect(), MongoFindOptions.NONE);
  }

  public MongoPageExecutor(MongoCollection<Document> collection, ClientSession session, MongoPageDialect dialect,
                           MongoFindOptions options) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.session = session;
    this.dialect = (dialect == null) ? new MongoPageDialect() : dialect;
    this.options = (options == null) ? MongoFindOptions.NONE : options;
  }

  /** Same collection, reads bound to {@code session}. */
  public MongoPageExecutor withSession(ClientSession session) {
    return new MongoPageExecutor(collection, Objects.requireNonNull(session, "session"), dialect, options);
  }

  /** Same collection, find and count both run with {@code options}. */
  public MongoPageExecutor withOptions(MongoFindOptions options) {
    return new MongoPageExecutor(collection, session, dialect, Objects.requireNonNull(options, "options"));
  }

  public MongoFindOptions options() { return options; }

  public String collectionName() { return collection.getNamespace().getCollectionName(); }

  @Override
  public List<Document> executeFind(PageQuery query) {
    MongoPageStatement st = dialect.find(collectionName(), query);
    long start = System.nanoTime();

    FindIterable<Document> find = (session == null) ? collection.find(st.filter()) : collection.find(session, st.filter());
    if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
    if (st.skip() != null && st.skip() > 0) find = find.skip(st.skip());
    if (st.limit() != null) find = find.limit(st.limit());
    find = options.applyTo(find);

    List<Document> out = new ArrayList<>();
    for (Document d : find) out.add(d);

    debugDone("find", st, out.size(), System.nanoTime() - start);
    return out;
  }

  @Override
  public long executeCount(QueryElement filter) {
    MongoPageStatement st = dialect.count(collectionName(), filter);
    long start = System.nanoTime();
    CountOptions countOptions = options.toCountOptions();
    long n = (session == null)
        ? collection.countDocuments(st.filter(), countOptions)
        : collection.countDocuments(session, st.filter(), countOptions);
    debugDone("count", st, n, System.nanoTime() - start);
    return n;
  }

  private void debugDone(String op, MongoPageStatement st, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    // filter keys only; values may carry PII
    log.debug("cursorpaging.mongo op={} collection={} filterKeys={} sort={} skip={} limit={} session={} options={} durationMs={} result={}",
        op, st.collection(), st.filter().keySet(), st.sort() == null ? "none" : st.sort().keySet(),
        st.skip(), st.limit(), session != null, options.describe(), durationNanos / 1_000_000.0, result);
  }
}
