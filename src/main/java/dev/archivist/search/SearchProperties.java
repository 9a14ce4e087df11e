package dev.archivist.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tuning for vector search, keyword scoring, fusion and reranking.
 *
 * <p>Properties are bound from {@code archivist.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code alpha} - vector weight in hybrid fusion (0.0 = keyword only, 1.0 = vector only;
 *       default 0.6)
 *   <li>{@code over-fetch-factor} - vector candidates fetched per requested result (default 3)
 *   <li>{@code fallback-relax-factor} - multiplier applied to the minimum score on the vector
 *       fallback pass (default 0.5)
 *   <li>{@code fallback-fetch-multiplier} - fetch size multiplier on the fallback pass (default 2)
 *   <li>{@code keyword-fetch-size} - size of the lexical candidate window (default 150)
 *   <li>{@code bm25-k1}, {@code bm25-b} - BM25 term saturation and length normalisation (1.5,
 *       0.75)
 *   <li>{@code rerank-factor} - candidates sent to the cross-encoder per requested result (2)
 *   <li>{@code rerank-weight} - cross-encoder share of the final score (default 0.7)
 *   <li>{@code rerank-sigmoid} - squash raw cross-encoder logits into [0, 1] (default true)
 *   <li>{@code store-retry-attempts}, {@code store-retry-backoff-ms} - vector store retry policy
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "archivist.search")
public class SearchProperties {

  private double alpha = 0.6;
  private int overFetchFactor = 3;
  private double fallbackRelaxFactor = 0.5;
  private int fallbackFetchMultiplier = 2;
  private int keywordFetchSize = 150;
  private double bm25K1 = 1.5;
  private double bm25B = 0.75;
  private int rerankFactor = 2;
  private double rerankWeight = 0.7;
  private boolean rerankSigmoid = true;
  private int storeRetryAttempts = 2;
  private long storeRetryBackoffMs = 200;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireUnit("alpha", alpha);
    requireUnit("rerank-weight", rerankWeight);
    requireUnit("fallback-relax-factor", fallbackRelaxFactor);
    if (overFetchFactor < 1) {
      throw new IllegalStateException(
          "archivist.search.over-fetch-factor must be >= 1, got: " + overFetchFactor);
    }
    if (fallbackFetchMultiplier < 1) {
      throw new IllegalStateException(
          "archivist.search.fallback-fetch-multiplier must be >= 1, got: "
              + fallbackFetchMultiplier);
    }
    if (keywordFetchSize < 1 || keywordFetchSize > 1000) {
      throw new IllegalStateException(
          "archivist.search.keyword-fetch-size must be in [1, 1000], got: " + keywordFetchSize);
    }
    if (bm25K1 < 0.0 || bm25B < 0.0 || bm25B > 1.0) {
      throw new IllegalStateException(
          "archivist.search.bm25-k1 must be >= 0 and bm25-b in [0.0, 1.0], got: "
              + bm25K1
              + ", "
              + bm25B);
    }
    if (rerankFactor < 1) {
      throw new IllegalStateException(
          "archivist.search.rerank-factor must be >= 1, got: " + rerankFactor);
    }
    if (storeRetryAttempts < 1) {
      throw new IllegalStateException(
          "archivist.search.store-retry-attempts must be >= 1, got: " + storeRetryAttempts);
    }
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "archivist.search." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public int getOverFetchFactor() {
    return overFetchFactor;
  }

  public void setOverFetchFactor(int overFetchFactor) {
    this.overFetchFactor = overFetchFactor;
  }

  public double getFallbackRelaxFactor() {
    return fallbackRelaxFactor;
  }

  public void setFallbackRelaxFactor(double fallbackRelaxFactor) {
    this.fallbackRelaxFactor = fallbackRelaxFactor;
  }

  public int getFallbackFetchMultiplier() {
    return fallbackFetchMultiplier;
  }

  public void setFallbackFetchMultiplier(int fallbackFetchMultiplier) {
    this.fallbackFetchMultiplier = fallbackFetchMultiplier;
  }

  public int getKeywordFetchSize() {
    return keywordFetchSize;
  }

  public void setKeywordFetchSize(int keywordFetchSize) {
    this.keywordFetchSize = keywordFetchSize;
  }

  public double getBm25K1() {
    return bm25K1;
  }

  public void setBm25K1(double bm25K1) {
    this.bm25K1 = bm25K1;
  }

  public double getBm25B() {
    return bm25B;
  }

  public void setBm25B(double bm25B) {
    this.bm25B = bm25B;
  }

  public int getRerankFactor() {
    return rerankFactor;
  }

  public void setRerankFactor(int rerankFactor) {
    this.rerankFactor = rerankFactor;
  }

  public double getRerankWeight() {
    return rerankWeight;
  }

  public void setRerankWeight(double rerankWeight) {
    this.rerankWeight = rerankWeight;
  }

  public boolean isRerankSigmoid() {
    return rerankSigmoid;
  }

  public void setRerankSigmoid(boolean rerankSigmoid) {
    this.rerankSigmoid = rerankSigmoid;
  }

  public int getStoreRetryAttempts() {
    return storeRetryAttempts;
  }

  public void setStoreRetryAttempts(int storeRetryAttempts) {
    this.storeRetryAttempts = storeRetryAttempts;
  }

  public long getStoreRetryBackoffMs() {
    return storeRetryBackoffMs;
  }

  public void setStoreRetryBackoffMs(long storeRetryBackoffMs) {
    this.storeRetryBackoffMs = storeRetryBackoffMs;
  }
}
