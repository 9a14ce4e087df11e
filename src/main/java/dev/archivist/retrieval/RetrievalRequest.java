package dev.archivist.retrieval;

import dev.archivist.query.SearchMode;
import org.jspecify.annotations.Nullable;

/**
 * A retrieval call as issued by the application layer.
 *
 * @param query the natural-language query, possibly with inline filters (must not be blank)
 * @param userId the requesting user (must not be blank)
 * @param k the maximum number of files to return (must be >= 1)
 * @param searchType which retrieval branches to run; null means hybrid
 * @param minScore optional minimum similarity / combined score; null means no threshold
 */
public record RetrievalRequest(
    String query, String userId, int k, SearchMode searchType, @Nullable Double minScore) {

  /** Default number of files when not specified. */
  public static final int DEFAULT_K = 5;

  /** Compact constructor validating input. */
  public RetrievalRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
    if (minScore != null && (minScore.isNaN() || minScore < 0.0 || minScore > 1.0)) {
      throw new IllegalArgumentException("minScore must be in [0, 1]");
    }
    if (searchType == null) {
      searchType = SearchMode.HYBRID;
    }
  }

  /** Convenience constructor: hybrid search, {@value #DEFAULT_K} files, no threshold. */
  public RetrievalRequest(String query, String userId) {
    this(query, userId, DEFAULT_K, SearchMode.HYBRID, null);
  }

  /** Convenience constructor: hybrid search, no threshold. */
  public RetrievalRequest(String query, String userId, int k) {
    this(query, userId, k, SearchMode.HYBRID, null);
  }

  public double minScoreOrZero() {
    return minScore == null ? 0.0 : minScore;
  }
}
