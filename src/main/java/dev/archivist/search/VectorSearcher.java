package dev.archivist.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.archivist.common.StageOutcome;
import dev.archivist.embedding.EmbeddingCache;
import dev.archivist.embedding.EmbeddingFailureException;
import dev.archivist.embedding.EmbeddingProperties;
import dev.archivist.query.RetrievalQuery;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;

/**
 * Semantic retrieval branch: embeds the query through the {@link EmbeddingCache} and asks the
 * vector store for the nearest chunks.
 *
 * <p>Pipeline: embed prefixed query -> build metadata filter from inline query filters -> primary
 * pass fetching {@code k * over-fetch-factor} chunks at {@code minScore} -> if fewer than {@code k}
 * came back and the store was not simply exhausted, a fallback pass with a relaxed minimum score
 * and a wider fetch -> candidates with {@code vectorScore = similarity}.
 *
 * <p>Transient store errors are retried; persistent ones are returned as a {@link
 * StoreUnavailableException} failure, embedding errors as an {@link EmbeddingFailureException}
 * failure. Nothing is swallowed.
 */
@Service
public class VectorSearcher {

  private static final Logger log = LoggerFactory.getLogger(VectorSearcher.class);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingCache embeddingCache;
  private final SearchProperties properties;
  private final String queryPrefix;
  private final RetryTemplate retryTemplate;

  public VectorSearcher(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingCache embeddingCache,
      SearchProperties properties,
      EmbeddingProperties embeddingProperties) {
    this.embeddingStore = embeddingStore;
    this.embeddingCache = embeddingCache;
    this.properties = properties;
    this.queryPrefix = embeddingProperties.queryPrefix();
    this.retryTemplate = buildRetryTemplate(properties);
  }

  /**
   * Runs the vector branch for a query.
   *
   * @param query the parsed query
   * @return candidates in store order (similarity descending, fallback additions last), or the
   *     failure that prevented the search
   */
  public StageOutcome<List<Candidate>> search(RetrievalQuery query) {
    return search(query, primary -> {});
  }

  /**
   * Runs the vector branch, handing the primary-pass candidates to {@code primaryResults} before
   * any fallback pass starts. Callers that give up on a slow fallback pass can still use them.
   *
   * @param query the parsed query
   * @param primaryResults receives an immutable copy of the primary-pass candidates
   * @return candidates in store order, or the failure that prevented the search
   */
  public StageOutcome<List<Candidate>> search(
      RetrievalQuery query, Consumer<List<Candidate>> primaryResults) {
    Embedding queryEmbedding;
    try {
      queryEmbedding = Embedding.from(embeddingCache.embed(queryPrefix + query.searchText()));
    } catch (EmbeddingFailureException e) {
      return StageOutcome.failure(e);
    }

    Filter filter = buildFilter(query.filters());
    int fetchSize = query.k() * properties.getOverFetchFactor();

    try {
      Map<String, Candidate> candidates = new LinkedHashMap<>();
      List<EmbeddingMatch<TextSegment>> primary =
          searchStore(queryEmbedding, fetchSize, query.minScore(), filter);
      addAll(candidates, primary);
      primaryResults.accept(List.copyOf(candidates.values()));

      boolean storeExhausted = primary.size() < fetchSize && query.minScore() <= 0.0;
      if (primary.size() < query.k() && !storeExhausted) {
        double relaxedMinScore = query.minScore() * properties.getFallbackRelaxFactor();
        int widenedFetch = fetchSize * properties.getFallbackFetchMultiplier();
        log.debug(
            "Vector primary pass returned {} of {} wanted; fallback with minScore={} fetch={}",
            primary.size(),
            query.k(),
            relaxedMinScore,
            widenedFetch);
        addAll(candidates, searchStore(queryEmbedding, widenedFetch, relaxedMinScore, filter));
      }

      log.debug("Vector search produced {} candidates", candidates.size());
      return StageOutcome.success(new ArrayList<>(candidates.values()));
    } catch (StoreUnavailableException e) {
      return StageOutcome.failure(e);
    }
  }

  private List<EmbeddingMatch<TextSegment>> searchStore(
      Embedding queryEmbedding, int maxResults, double minScore, @Nullable Filter filter) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(maxResults)
            .minScore(Math.max(0.0, minScore));
    if (filter != null) {
      builder.filter(filter);
    }
    EmbeddingSearchRequest request = builder.build();
    try {
      return retryTemplate.execute(context -> embeddingStore.search(request)).matches();
    } catch (RuntimeException e) {
      throw new StoreUnavailableException("Vector store search failed: " + e.getMessage(), e);
    }
  }

  private static void addAll(
      Map<String, Candidate> candidates, List<EmbeddingMatch<TextSegment>> matches) {
    for (EmbeddingMatch<TextSegment> match : matches) {
      TextSegment segment = match.embedded();
      if (segment == null || candidates.containsKey(match.embeddingId())) {
        continue;
      }
      double similarity = match.score() == null ? 0.0 : match.score();
      candidates.put(
          match.embeddingId(),
          new Candidate(match.embeddingId(), segment.text(), segment.metadata().toMap())
              .withVectorScore(Math.min(1.0, Math.max(0.0, similarity))));
    }
  }

  /**
   * Builds a LangChain4j Filter from inline query filters. A key with one value becomes an equality
   * test, a key with several a membership test; keys are combined with AND logic.
   *
   * @param filters parsed inline filters
   * @return combined Filter, or null if there are no filters
   */
  @Nullable Filter buildFilter(Map<String, List<String>> filters) {
    List<Filter> parts = new ArrayList<>();
    filters.forEach(
        (key, values) -> {
          if (values.size() == 1) {
            parts.add(metadataKey(key).isEqualTo(values.get(0)));
          } else if (!values.isEmpty()) {
            parts.add(metadataKey(key).isIn(values));
          }
        });
    return parts.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }

  private static RetryTemplate buildRetryTemplate(SearchProperties properties) {
    RetryTemplateBuilder builder =
        RetryTemplate.builder()
            .maxAttempts(properties.getStoreRetryAttempts())
            .retryOn(RuntimeException.class);
    if (properties.getStoreRetryBackoffMs() > 0) {
      builder.fixedBackoff(properties.getStoreRetryBackoffMs());
    } else {
      builder.noBackoff();
    }
    return builder.build();
  }
}
