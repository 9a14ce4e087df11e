package dev.archivist.retrieval;

import dev.archivist.access.AccessFilter;
import dev.archivist.access.AccessFilterResult;
import dev.archivist.access.AccessPolicy;
import dev.archivist.access.AccessResolver;
import dev.archivist.common.RetrievalCancelledException;
import dev.archivist.common.RetrievalException;
import dev.archivist.common.StageOutcome;
import dev.archivist.common.StageRejectedException;
import dev.archivist.common.StageTimeoutException;
import dev.archivist.query.ParsedQuery;
import dev.archivist.query.QueryParser;
import dev.archivist.query.RetrievalQuery;
import dev.archivist.query.SearchMode;
import dev.archivist.search.Candidate;
import dev.archivist.search.Deduplicator;
import dev.archivist.search.HybridCombiner;
import dev.archivist.search.KeywordScorer;
import dev.archivist.search.RerankerService;
import dev.archivist.search.SearchProperties;
import dev.archivist.search.VectorSearcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Sequences one retrieval: parse, vector and keyword retrieval in parallel, fusion, reranking,
 * deduplication, access filtering and file aggregation.
 *
 * <p>Retrieval branches and reranking run on the retrieval executor, each against a deadline of
 * {@code archivist.retrieval.stage-timeout}. A branch the executor rejects counts as failed. A
 * timed-out vector branch contributes its primary-pass candidates if that pass had finished;
 * otherwise a timed-out or failed branch contributes nothing. The request only fails when every
 * branch its mode needs has failed. A failed rerank keeps the fused order. Access filtering always
 * runs on the calling thread and nothing is returned before it.
 *
 * <p>Failure causes are logged; the returned trace only carries fixed category names.
 *
 * <p>Candidates are only mutated on the calling thread: worker threads produce fresh candidate
 * lists (retrieval) or plain scores (reranking).
 */
@Service
public class RetrievalOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

  private final QueryParser queryParser;
  private final VectorSearcher vectorSearcher;
  private final KeywordScorer keywordScorer;
  private final RerankerService rerankerService;
  private final Deduplicator deduplicator;
  private final AccessResolver accessResolver;
  private final AccessFilter accessFilter;
  private final FileAggregator fileAggregator;
  private final SearchProperties searchProperties;
  private final RetrievalProperties retrievalProperties;
  private final AsyncTaskExecutor executor;
  private final Clock clock;

  public RetrievalOrchestrator(
      QueryParser queryParser,
      VectorSearcher vectorSearcher,
      KeywordScorer keywordScorer,
      RerankerService rerankerService,
      Deduplicator deduplicator,
      AccessResolver accessResolver,
      AccessFilter accessFilter,
      FileAggregator fileAggregator,
      SearchProperties searchProperties,
      RetrievalProperties retrievalProperties,
      @Qualifier("retrievalExecutor") AsyncTaskExecutor executor,
      Clock clock) {
    this.queryParser = queryParser;
    this.vectorSearcher = vectorSearcher;
    this.keywordScorer = keywordScorer;
    this.rerankerService = rerankerService;
    this.deduplicator = deduplicator;
    this.accessResolver = accessResolver;
    this.accessFilter = accessFilter;
    this.fileAggregator = fileAggregator;
    this.searchProperties = searchProperties;
    this.retrievalProperties = retrievalProperties;
    this.executor = executor;
    this.clock = clock;
  }

  /** Creates a fresh context for callers that never cancel. */
  public RetrievalContext newContext() {
    return new RetrievalContext(clock);
  }

  public RetrievalResponse retrieve(RetrievalRequest request) {
    return retrieve(request, newContext());
  }

  /**
   * Runs a retrieval.
   *
   * @param request the validated request
   * @param context cancellation switch and trace; {@link RetrievalContext#cancel()} makes the
   *     call return {@link RetrievalStatus#FAILED}
   * @return the result envelope; never throws for stage failures
   */
  public RetrievalResponse retrieve(RetrievalRequest request, RetrievalContext context) {
    RetrievalTrace trace = context.trace();
    RetrievalResponse response = run(request, context, trace);
    log.info(
        "Retrieval for user {} finished: status={} files={} mode={} took={}ms",
        request.userId(),
        response.status(),
        response.files().size(),
        request.searchType().value(),
        response.trace().total().toMillis());
    return response;
  }

  private RetrievalResponse run(
      RetrievalRequest request, RetrievalContext context, RetrievalTrace trace) {
    Instant start = trace.now();
    ParsedQuery parsed = queryParser.parse(request.query());
    RetrievalQuery query =
        RetrievalQuery.of(
            request.query(), parsed, request.k(), request.minScoreOrZero(), request.searchType());
    trace.enter(RetrievalStage.PARSED);
    trace.span("parse", start, parsed.filters().size(), "ok");

    AccessPolicy policy;
    try {
      policy = accessResolver.resolve(request.userId());
    } catch (RuntimeException e) {
      log.warn("Access policy resolution failed for user {}: {}", request.userId(), e.getMessage());
      return fail(trace, "access policy unavailable");
    }

    // Retrieval branches
    long deadline = deadlineFromNow();
    AtomicReference<List<Candidate>> vectorPrimary = new AtomicReference<>();
    Future<StageOutcome<List<Candidate>>> vectorFuture =
        query.mode().usesVector()
            ? submit(
                context,
                trace,
                "vector",
                () -> vectorSearcher.search(query, vectorPrimary::set),
                List::size)
            : null;
    Future<StageOutcome<List<Candidate>>> keywordFuture =
        query.mode().usesKeyword()
            ? submit(context, trace, "keyword", () -> keywordScorer.search(query), List::size)
            : null;

    StageOutcome<List<Candidate>> vector =
        vectorFuture == null
            ? StageOutcome.success(List.of())
            : await("vector", vectorFuture, deadline, context, trace);
    StageOutcome<List<Candidate>> keyword =
        keywordFuture == null
            ? StageOutcome.success(List.of())
            : await("keyword", keywordFuture, deadline, context, trace);
    trace.enter(RetrievalStage.RETRIEVED);

    if (isTimeout(vector) && vectorPrimary.get() != null) {
      degrade(trace, "vector fallback pass timed out, primary pass kept", vector);
      vector = StageOutcome.success(vectorPrimary.get());
    }

    if (context.isCancelled() || isCancellation(vector) || isCancellation(keyword)) {
      return fail(trace, "cancelled during retrieval");
    }

    double alpha = alphaFor(query.mode());
    if (!vector.isSuccess() && !keyword.isSuccess()) {
      return fail(
          trace,
          "all retrieval branches failed",
          "vector: " + describe(vector) + "; keyword: " + describe(keyword));
    }
    if (!vector.isSuccess()) {
      if (query.mode() == SearchMode.VECTOR) {
        return fail(trace, "vector branch failed: " + category(vector), describe(vector));
      }
      degrade(trace, "vector branch failed, keyword only: " + category(vector), vector);
      alpha = 0.0;
    } else if (!keyword.isSuccess()) {
      if (query.mode() == SearchMode.KEYWORD) {
        return fail(trace, "keyword branch failed: " + category(keyword), describe(keyword));
      }
      degrade(trace, "keyword branch failed, vector only: " + category(keyword), keyword);
      alpha = 1.0;
    }

    // Fusion
    start = trace.now();
    List<Candidate> ranked =
        HybridCombiner.combine(
            vector.valueOr(List.of()), keyword.valueOr(List.of()), alpha, query.minScore());
    trace.enter(RetrievalStage.COMBINED);
    trace.span("combine", start, ranked.size(), "ok");

    // Reranking
    ranked = rerank(query, ranked, context, trace);
    trace.enter(RetrievalStage.RERANKED);
    if (context.isCancelled()) {
      return fail(trace, "cancelled during reranking");
    }

    // Deduplication
    start = trace.now();
    List<Candidate> unique = deduplicator.deduplicate(ranked);
    trace.enter(RetrievalStage.DEDUPLICATED);
    trace.span("deduplicate", start, unique.size(), "ok");

    // Access filtering
    start = trace.now();
    AccessFilterResult filtered = accessFilter.filter(unique, policy, request.userId());
    trace.enter(RetrievalStage.FILTERED);
    trace.filteredSpan("access-filter", start, filtered.allowed().size(), "ok");

    // Aggregation
    start = trace.now();
    FileAggregator.Aggregation aggregation =
        fileAggregator.aggregate(
            filtered.allowed(), query.k(), retrievalProperties.maxChunksPerFile());
    trace.enter(RetrievalStage.AGGREGATED);
    trace.filteredSpan("aggregate", start, aggregation.files().size(), "ok");
    trace.enter(RetrievalStage.DONE);

    if (!aggregation.files().isEmpty()) {
      return new RetrievalResponse(
          RetrievalStatus.OK, "", aggregation.files(), aggregation.truncated(), trace.snapshot());
    }
    if (!unique.isEmpty() && filtered.deniedCount() > 0) {
      return RetrievalResponse.of(RetrievalStatus.NO_ACCESSIBLE_RESULTS, trace);
    }
    return RetrievalResponse.of(RetrievalStatus.NO_RESULTS, trace);
  }

  private List<Candidate> rerank(
      RetrievalQuery query, List<Candidate> ranked, RetrievalContext context, RetrievalTrace trace) {
    if (!rerankerService.isEnabled() || ranked.isEmpty()) {
      trace.span("rerank", trace.now(), 0, "skipped");
      return ranked;
    }
    List<Candidate> head =
        List.copyOf(ranked.subList(0, Math.min(rerankerService.headSize(query.k()), ranked.size())));
    Future<StageOutcome<List<Double>>> future =
        submit(
            context,
            trace,
            "rerank",
            () -> rerankerService.scoreTop(query.searchText(), head),
            List::size);
    StageOutcome<List<Double>> scores = await("rerank", future, deadlineFromNow(), context, trace);
    if (scores instanceof StageOutcome.Success<List<Double>> success) {
      return rerankerService.applyScores(ranked, success.value());
    }
    if (!isCancellation(scores)) {
      degrade(trace, "rerank unavailable, fused order kept: " + category(scores), scores);
    }
    return ranked;
  }

  private <T> Future<StageOutcome<T>> submit(
      RetrievalContext context,
      RetrievalTrace trace,
      String name,
      Callable<StageOutcome<T>> stage,
      Function<T, Integer> itemCount) {
    Future<StageOutcome<T>> future;
    try {
      future =
          executor.submit(
              () -> {
                Instant start = trace.now();
                StageOutcome<T> outcome = stage.call();
                if (outcome instanceof StageOutcome.Success<T> success) {
                  trace.span(name, start, itemCount.apply(success.value()), "ok");
                } else {
                  trace.span(name, start, 0, "failed");
                }
                return outcome;
              });
    } catch (TaskRejectedException e) {
      log.warn("Retrieval executor rejected stage '{}': {}", name, e.getMessage());
      trace.span(name, trace.now(), 0, "rejected");
      return CompletableFuture.completedFuture(
          StageOutcome.failure(new StageRejectedException(name, e)));
    }
    context.register(future);
    return future;
  }

  private <T> StageOutcome<T> await(
      String name,
      Future<StageOutcome<T>> future,
      long deadlineNanos,
      RetrievalContext context,
      RetrievalTrace trace) {
    Duration timeout = retrievalProperties.stageTimeout();
    try {
      long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      trace.span(name, trace.now(), 0, "timeout");
      return StageOutcome.failure(new StageTimeoutException(name, timeout));
    } catch (CancellationException e) {
      return StageOutcome.failure(new RetrievalCancelledException(name));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return StageOutcome.failure(new RetrievalCancelledException(name));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RetrievalException retrievalException) {
        return StageOutcome.failure(retrievalException);
      }
      return StageOutcome.failure(new RetrievalException("Stage '" + name + "' failed", cause));
    } finally {
      context.release(future);
    }
  }

  private long deadlineFromNow() {
    return System.nanoTime() + retrievalProperties.stageTimeout().toNanos();
  }

  private double alphaFor(SearchMode mode) {
    return switch (mode) {
      case VECTOR -> 1.0;
      case KEYWORD -> 0.0;
      case HYBRID -> searchProperties.getAlpha();
    };
  }

  private static boolean isTimeout(StageOutcome<?> outcome) {
    return outcome.error().filter(StageTimeoutException.class::isInstance).isPresent();
  }

  private static boolean isCancellation(StageOutcome<?> outcome) {
    return outcome.error().filter(RetrievalCancelledException.class::isInstance).isPresent();
  }

  private static String describe(StageOutcome<?> outcome) {
    return outcome.error().map(Throwable::getMessage).orElse("unknown");
  }

  /** Exception class name without the {@code Exception} suffix, e.g. {@code StoreUnavailable}. */
  static String category(StageOutcome<?> outcome) {
    return outcome
        .error()
        .map(e -> e.getClass().getSimpleName().replaceFirst("Exception$", ""))
        .orElse("Unknown");
  }

  private static void degrade(RetrievalTrace trace, String note, StageOutcome<?> cause) {
    log.warn("Retrieval degraded: {} ({})", note, describe(cause));
    trace.degrade(note);
  }

  private static RetrievalResponse fail(RetrievalTrace trace, String reason) {
    return fail(trace, reason, reason);
  }

  private static RetrievalResponse fail(RetrievalTrace trace, String reason, String detail) {
    log.warn("Retrieval failed: {} ({})", reason, detail);
    trace.degrade(reason);
    trace.enter(RetrievalStage.ERRORED);
    return RetrievalResponse.of(RetrievalStatus.FAILED, trace);
  }
}
