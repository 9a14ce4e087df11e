package dev.archivist.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.archivist.access.AccessFilter;
import dev.archivist.access.AccessPolicy;
import dev.archivist.access.AccessProperties;
import dev.archivist.access.AccessResolver;
import dev.archivist.access.FilenameNormalizer;
import dev.archivist.common.StageOutcome;
import dev.archivist.embedding.EmbeddingFailureException;
import dev.archivist.fixture.CandidateBuilder;
import dev.archivist.query.QueryParser;
import dev.archivist.query.RetrievalQuery;
import dev.archivist.query.SearchMode;
import dev.archivist.search.Candidate;
import dev.archivist.search.Deduplicator;
import dev.archivist.search.KeywordScorer;
import dev.archivist.search.RerankerService;
import dev.archivist.search.SearchProperties;
import dev.archivist.search.StoreUnavailableException;
import dev.archivist.search.VectorSearcher;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class RetrievalOrchestratorTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  @Mock VectorSearcher vectorSearcher;
  @Mock KeywordScorer keywordScorer;
  @Mock AccessResolver accessResolver;
  @Mock ScoringModel scoringModel;

  private ThreadPoolTaskExecutor executor;
  private SearchProperties searchProperties;
  private FilenameNormalizer normalizer;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setThreadNamePrefix("retrieval-test-");
    executor.initialize();
    searchProperties = new SearchProperties();
    searchProperties.setRerankSigmoid(false);
    normalizer = new FilenameNormalizer(new AccessProperties(List.of("temp_"), List.of(), Map.of()));
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void refundPolicyScenarioReturnsOnlyAuthorizedFile() {
    searchProperties.setAlpha(0.5);
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.allowing(Set.of("policies.md")));
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("p").text("Refunds within 30 days.").file("policies.md").vector(0.82).build(),
                    new CandidateBuilder().id("s").text("Salary bands 2026.").file("salaries.md").vector(0.91).build())));
    given(keywordScorer.search(any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("p").text("Refunds within 30 days.").file("policies.md").keyword(0.4).build(),
                    new CandidateBuilder().id("s").text("Salary bands 2026.").file("salaries.md").keyword(0.6).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund policy", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.message()).isEmpty();
    assertThat(response.files()).singleElement().satisfies(file -> {
      assertThat(file.fileName()).isEqualTo("policies.md");
      assertThat(file.score()).isCloseTo(0.61, within(1e-9));
    });
    assertThat(response.trace().stages())
        .containsExactly(
            RetrievalStage.PARSED,
            RetrievalStage.RETRIEVED,
            RetrievalStage.COMBINED,
            RetrievalStage.RERANKED,
            RetrievalStage.DEDUPLICATED,
            RetrievalStage.FILTERED,
            RetrievalStage.AGGREGATED,
            RetrievalStage.DONE);
  }

  @Test
  void traceCarriesNoCountsFromBeforeAccessFiltering() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.allowing(Set.of("policies.md")));
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("p").text("Refunds within 30 days.").file("policies.md").vector(0.82).build(),
                    new CandidateBuilder().id("s").text("Salary bands 2026.").file("salaries.md").vector(0.91).build())));
    given(keywordScorer.search(any()))
        .willReturn(
            StageOutcome.success(
                List.of(new CandidateBuilder().id("s").text("Salary bands 2026.").file("salaries.md").keyword(0.6).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund policy", "alice"));

    assertThat(response.trace().spans())
        .filteredOn(span -> !span.name().equals("access-filter") && !span.name().equals("aggregate"))
        .isNotEmpty()
        .allSatisfy(span -> assertThat(span.itemCount()).isNull());
    assertThat(response.trace().spans())
        .filteredOn(span -> span.name().equals("access-filter"))
        .singleElement()
        .satisfies(span -> assertThat(span.itemCount()).isEqualTo(1));
    assertThat(response.trace().degradations()).isEmpty();
  }

  @Test
  void passesParsedQueryToBranches() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any())).willReturn(StageOutcome.success(List.of()));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));

    orchestrator(Duration.ofSeconds(5), false)
        .retrieve(new RetrievalRequest("refund type:pdf", "alice", 3, SearchMode.HYBRID, 0.2));

    ArgumentCaptor<RetrievalQuery> captor = ArgumentCaptor.forClass(RetrievalQuery.class);
    verify(vectorSearcher).search(captor.capture(), any());
    RetrievalQuery query = captor.getValue();
    assertThat(query.searchText()).isEqualTo("refund");
    assertThat(query.filters()).containsEntry("type", List.of("pdf"));
    assertThat(query.k()).isEqualTo(3);
    assertThat(query.minScore()).isEqualTo(0.2);
  }

  @Test
  void vectorFailureInHybridModeDegradesToKeywordOnly() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.failure(new EmbeddingFailureException("model offline")));
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("k").file("faq.md").keyword(0.8).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files()).singleElement().satisfies(f -> assertThat(f.score()).isEqualTo(0.8));
    assertThat(response.trace().degradations())
        .containsExactly("vector branch failed, keyword only: EmbeddingFailure");
  }

  @Test
  void keywordFailureInHybridModeDegradesToVectorOnly() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("v").file("faq.md").vector(0.7).build())));
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.failure(new StoreUnavailableException("db down", new RuntimeException())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files().get(0).score()).isEqualTo(0.7);
  }

  @Test
  void degradationNotesNameTheFailureWithoutDriverDetail() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("v").file("faq.md").vector(0.7).build())));
    given(keywordScorer.search(any()))
        .willReturn(
            StageOutcome.failure(
                new StoreUnavailableException(
                    "Keyword search failed: connection to 10.0.0.5:5432 refused", new RuntimeException())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.trace().degradations())
        .containsExactly("keyword branch failed, vector only: StoreUnavailable");
  }

  @Test
  void failedResponseDoesNotExposeFailureMessages() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.failure(new StoreUnavailableException("pgvector: relation missing", new RuntimeException())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false)
            .retrieve(new RetrievalRequest("refund", "alice", 5, SearchMode.VECTOR, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
    assertThat(response.trace().degradations()).containsExactly("vector branch failed: StoreUnavailable");
  }

  @Test
  void rejectedBranchDegradesInsteadOfThrowing() {
    ThreadPoolTaskExecutor saturated = singleThreadWithoutQueue();
    try {
      given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
      given(vectorSearcher.search(any(), any()))
          .willAnswer(
              invocation -> {
                Thread.sleep(300);
                return StageOutcome.success(List.of(new CandidateBuilder().id("v").file("faq.md").vector(0.7).build()));
              });

      RetrievalResponse response =
          orchestrator(Duration.ofSeconds(5), false, saturated)
              .retrieve(new RetrievalRequest("refund", "alice"));

      assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
      assertThat(response.files().get(0).score()).isEqualTo(0.7);
      assertThat(response.trace().degradations())
          .containsExactly("keyword branch failed, vector only: StageRejected");
      assertThat(response.trace().spans())
          .anySatisfy(span -> {
            assertThat(span.name()).isEqualTo("keyword");
            assertThat(span.outcome()).isEqualTo("rejected");
          });
      verify(keywordScorer, never()).search(any());
    } finally {
      saturated.shutdown();
    }
  }

  @Test
  void rejectedOnlyBranchIsFailed() throws Exception {
    ThreadPoolTaskExecutor saturated = singleThreadWithoutQueue();
    CountDownLatch release = new CountDownLatch(1);
    try {
      saturated.submit(
          () -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
          });
      given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());

      RetrievalResponse response =
          orchestrator(Duration.ofSeconds(5), false, saturated)
              .retrieve(new RetrievalRequest("refund", "alice", 5, SearchMode.KEYWORD, null));

      assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
      assertThat(response.trace().stages()).endsWith(RetrievalStage.RETRIEVED, RetrievalStage.ERRORED);
      verify(keywordScorer, never()).search(any());
    } finally {
      release.countDown();
      saturated.shutdown();
    }
  }

  @Test
  void allBranchesFailingIsFailed() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.failure(new StoreUnavailableException("down", new RuntimeException())));
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.failure(new StoreUnavailableException("down", new RuntimeException())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
    assertThat(response.message()).isEqualTo("Retrieval failed. Please try again.");
    assertThat(response.files()).isEmpty();
    assertThat(response.trace().stages()).endsWith(RetrievalStage.RETRIEVED, RetrievalStage.ERRORED);
  }

  @Test
  void vectorModeRunsOnlyVectorBranchAndFailsWithIt() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.failure(new StoreUnavailableException("down", new RuntimeException())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false)
            .retrieve(new RetrievalRequest("refund", "alice", 5, SearchMode.VECTOR, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
    verify(keywordScorer, never()).search(any());
  }

  @Test
  void keywordModeUsesKeywordScoresAtFullWeight() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("k").file("faq.md").keyword(0.45).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false)
            .retrieve(new RetrievalRequest("refund", "alice", 5, SearchMode.KEYWORD, null));

    assertThat(response.files().get(0).score()).isEqualTo(0.45);
    verify(vectorSearcher, never()).search(any(), any());
  }

  @Test
  void everythingFilteredIsNoAccessibleResults() {
    given(accessResolver.resolve("bob")).willReturn(AccessPolicy.allowing(Set.of("handbook.pdf")));
    given(vectorSearcher.search(any(), any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("s").file("salaries.md").vector(0.9).build())));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("salaries", "bob"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.NO_ACCESSIBLE_RESULTS);
    assertThat(response.message()).isEqualTo("No content you're authorized to view matches this query.");
    assertThat(response.files()).isEmpty();
  }

  @Test
  void emptyVectorAndZeroKeywordScoresWithThresholdIsNoResults() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any())).willReturn(StageOutcome.success(List.of()));
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("k").file("faq.md").keyword(0.0).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false)
            .retrieve(new RetrievalRequest("zebra", "alice", 5, SearchMode.HYBRID, 0.1));

    assertThat(response.status()).isEqualTo(RetrievalStatus.NO_RESULTS);
    assertThat(response.files()).isEmpty();
  }

  @Test
  void timedOutBranchCountsAsFailed() {
    CountDownLatch never = new CountDownLatch(1);
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willAnswer(
            invocation -> {
              never.await(5, TimeUnit.SECONDS);
              return StageOutcome.success(List.of());
            });
    given(keywordScorer.search(any()))
        .willReturn(StageOutcome.success(List.of(new CandidateBuilder().id("k").file("faq.md").keyword(0.6).build())));

    RetrievalResponse response =
        orchestrator(Duration.ofMillis(200), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files().get(0).score()).isEqualTo(0.6);
    assertThat(response.trace().spans())
        .anySatisfy(span -> {
          assertThat(span.name()).isEqualTo("vector");
          assertThat(span.outcome()).isEqualTo("timeout");
        });
  }

  @Test
  void timedOutFallbackPassKeepsPrimaryVectorCandidates() {
    CountDownLatch never = new CountDownLatch(1);
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willAnswer(
            invocation -> {
              Consumer<List<Candidate>> primary = invocation.getArgument(1);
              primary.accept(List.of(new CandidateBuilder().id("v").file("faq.md").vector(0.75).build()));
              never.await(5, TimeUnit.SECONDS);
              return StageOutcome.success(List.of());
            });
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));

    RetrievalResponse response =
        orchestrator(Duration.ofMillis(200), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files()).singleElement().satisfies(file -> {
      assertThat(file.fileName()).isEqualTo("faq.md");
      assertThat(file.score()).isCloseTo(0.45, within(1e-9));
    });
    assertThat(response.trace().degradations())
        .containsExactly("vector fallback pass timed out, primary pass kept");
  }

  @Test
  void cancellationReturnsFailed() throws Exception {
    CountDownLatch started = new CountDownLatch(2);
    CountDownLatch never = new CountDownLatch(1);
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willAnswer(
            invocation -> {
              started.countDown();
              never.await(10, TimeUnit.SECONDS);
              return StageOutcome.success(List.of());
            });
    given(keywordScorer.search(any()))
        .willAnswer(
            invocation -> {
              started.countDown();
              never.await(10, TimeUnit.SECONDS);
              return StageOutcome.success(List.of());
            });
    RetrievalOrchestrator orchestrator = orchestrator(Duration.ofSeconds(10), false);
    RetrievalContext context = orchestrator.newContext();
    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<RetrievalResponse> pending =
          caller.submit(() -> orchestrator.retrieve(new RetrievalRequest("refund", "alice"), context));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      context.cancel();

      RetrievalResponse response = pending.get(5, TimeUnit.SECONDS);
      assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
      assertThat(context.isCancelled()).isTrue();
    } finally {
      caller.shutdownNow();
    }
  }

  @Test
  void rerankerReordersHeadWhenAvailable() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("a").text("first passage").file("a.md").vector(0.9).build(),
                    new CandidateBuilder().id("b").text("second passage").file("b.md").vector(0.8).build())));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));
    given(scoringModel.scoreAll(anyList(), anyString())).willReturn(Response.from(List.of(0.0, 1.0)));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), true).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.files()).extracting(FileAggregate::fileName).containsExactly("b.md", "a.md");
  }

  @Test
  void rerankFailureKeepsFusedOrder() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("a").text("first passage").file("a.md").vector(0.9).build(),
                    new CandidateBuilder().id("b").text("second passage").file("b.md").vector(0.8).build())));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));
    given(scoringModel.scoreAll(anyList(), anyString())).willThrow(new RuntimeException("onnx crashed"));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), true).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files()).extracting(FileAggregate::fileName).containsExactly("a.md", "b.md");
    assertThat(response.trace().degradations()).anyMatch(note -> note.contains("rerank"));
  }

  @Test
  void duplicateChunksAreCollapsed() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("a").text("Same text").file("a.md").vector(0.9).build(),
                    new CandidateBuilder().id("b").text("same   TEXT").file("a.md").vector(0.8).build())));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("same", "alice"));

    assertThat(response.files().get(0).chunks()).extracting(Candidate::chunkId).containsExactly("a");
  }

  @Test
  void resolverFailureIsFailedWithoutRetrieval() {
    given(accessResolver.resolve("alice")).willThrow(new IllegalStateException("directory offline"));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("refund", "alice"));

    assertThat(response.status()).isEqualTo(RetrievalStatus.FAILED);
    verify(vectorSearcher, never()).search(any(), any());
  }

  @Test
  void moreFilesThanKAreTruncated() {
    given(accessResolver.resolve("alice")).willReturn(AccessPolicy.unrestricted());
    given(vectorSearcher.search(any(), any()))
        .willReturn(
            StageOutcome.success(
                List.of(
                    new CandidateBuilder().id("a").text("a").file("a.md").vector(0.9).build(),
                    new CandidateBuilder().id("b").text("b").file("b.md").vector(0.8).build(),
                    new CandidateBuilder().id("c").text("c").file("c.md").vector(0.7).build())));
    given(keywordScorer.search(any())).willReturn(StageOutcome.success(List.of()));

    RetrievalResponse response =
        orchestrator(Duration.ofSeconds(5), false).retrieve(new RetrievalRequest("q", "alice", 2));

    assertThat(response.files()).hasSize(2);
    assertThat(response.truncated()).isTrue();
  }

  private RetrievalOrchestrator orchestrator(Duration stageTimeout, boolean withReranker) {
    return orchestrator(stageTimeout, withReranker, executor);
  }

  private RetrievalOrchestrator orchestrator(
      Duration stageTimeout, boolean withReranker, AsyncTaskExecutor taskExecutor) {
    RerankerService reranker =
        new RerankerService(withReranker ? Optional.of(scoringModel) : Optional.empty(), searchProperties);
    return new RetrievalOrchestrator(
        new QueryParser(),
        vectorSearcher,
        keywordScorer,
        reranker,
        new Deduplicator(),
        accessResolver,
        new AccessFilter(normalizer),
        new FileAggregator(normalizer),
        searchProperties,
        new RetrievalProperties(stageTimeout, 5, 4),
        taskExecutor,
        CLOCK);
  }

  private static ThreadPoolTaskExecutor singleThreadWithoutQueue() {
    ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
    saturated.setCorePoolSize(1);
    saturated.setMaxPoolSize(1);
    saturated.setQueueCapacity(0);
    saturated.setThreadNamePrefix("retrieval-saturated-");
    saturated.initialize();
    return saturated;
  }
}
