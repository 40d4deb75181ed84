package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.cursor.BsonCursorCodec;
import io.intellixity.cursorpaging.cursor.CursorCodec;
import io.intellixity.cursorpaging.paging.*;
import io.intellixity.cursorpaging.query.QueryElement;
import io.intellixity.cursorpaging.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Pagination entry point: translate → find (+ count) → assemble.\n
 *
 * Stateless and thread-safe; one instance serves any number of concurrent requests.
 * The count runs against the caller's base filter only, never the seek predicate, so it is the same for
 * every page of a result set. With a {@link PagingSettings#countExecutor()} it runs concurrently with the find.
 *
 * @param <R> raw row type of the backend
 * @param <T> item type handed to the caller
 */
public final class Paginator<R, T> {
  private static final Logger log = LoggerFactory.getLogger(Paginator.class);

  private final PageExecutor<R> executor;
  private final QueryTranslator translator;
  private final PageAssembler<R, T> assembler;
  private final PagingSettings settings;

  public Paginator(PageExecutor<R> executor,
                   FieldReader<R> fields,
                   Function<R, T> mapper,
                   CursorCodec codec,
                   PagingSettings settings) {
    this.executor = Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(codec, "codec");
    this.translator = new QueryTranslator(codec);
    this.assembler = new PageAssembler<>(codec, fields, mapper);
    this.settings = (settings == null) ? PagingSettings.defaults() : settings;
  }

  public static <R, T> Paginator<R, T> of(PageExecutor<R> executor, FieldReader<R> fields, Function<R, T> mapper) {
    return new Paginator<>(executor, fields, mapper, new BsonCursorCodec(), PagingSettings.defaults());
  }

  /** Request builder preloaded with this paginator's default limit, count flag and tie-breaker. */
  public PaginationRequest.Builder newRequest() {
    return PaginationRequest.builder()
        .limit(settings.defaultLimit())
        .includeTotalCount(settings.countTotal())
        .tieBreaker(settings.tieBreakerField());
  }

  public FindResult<T> paginate(PaginationRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.limit() > settings.maxLimit()) {
      throw new InvalidLimitException("limit " + request.limit() + " exceeds max " + settings.maxLimit());
    }

    PageQuery query = translator.translate(request);
    long start = System.nanoTime();

    CompletableFuture<Long> pendingCount = null;
    if (request.includeTotalCount() && settings.countExecutor() != null) {
      pendingCount = CompletableFuture.supplyAsync(() -> count(request.filter()), settings.countExecutor());
    }

    List<R> rows;
    try {
      rows = find(query);
    } catch (RuntimeException e) {
      if (pendingCount != null) pendingCount.cancel(true);
      throw e;
    }

    Long total = null;
    if (request.includeTotalCount()) {
      total = (pendingCount != null) ? join(pendingCount) : count(request.filter());
    }

    FindResult<T> result = assembler.assemble(request, rows, total);
    if (log.isDebugEnabled()) {
      log.debug("cursorpaging.page mode={} direction={} limit={} fetched={} returned={} hasNext={} hasPrevious={} durationMs={}",
          request.mode().getClass().getSimpleName(), request.direction(), request.limit(), rows.size(),
          result.items().size(), result.pageInfo().hasNextPage(), result.pageInfo().hasPreviousPage(),
          (System.nanoTime() - start) / 1_000_000.0);
    }
    return result;
  }

  private List<R> find(PageQuery query) {
    try {
      return executor.executeFind(query);
    } catch (PaginationException | QueryValidationException | PagingContractViolationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExecutionFailureException("find", e);
    }
  }

  private long count(QueryElement baseFilter) {
    try {
      return executor.executeCount(baseFilter);
    } catch (PaginationException | QueryValidationException | PagingContractViolationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExecutionFailureException("count", e);
    }
  }

  private static long join(CompletableFuture<Long> pending) {
    try {
      return pending.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new ExecutionFailureException("count", cause == null ? e : cause);
    } catch (CancellationException e) {
      throw new ExecutionFailureException("count", e);
    }
  }
}
