package dev.archivist.retrieval;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Orchestration settings bound from {@code archivist.retrieval.*}.
 *
 * @param stageTimeout budget for each concurrent stage (retrieval branches, reranking)
 * @param maxChunksPerFile chunks kept per file in the result
 * @param poolSize worker threads of the retrieval executor
 */
@ConfigurationProperties(prefix = "archivist.retrieval")
public record RetrievalProperties(
    @DefaultValue("5s") Duration stageTimeout,
    @DefaultValue("5") int maxChunksPerFile,
    @DefaultValue("8") int poolSize) {

  public RetrievalProperties {
    if (stageTimeout.isNegative() || stageTimeout.isZero()) {
      throw new IllegalArgumentException("archivist.retrieval.stage-timeout must be positive");
    }
    if (maxChunksPerFile < 1) {
      throw new IllegalArgumentException("archivist.retrieval.max-chunks-per-file must be >= 1");
    }
    if (poolSize < 1) {
      throw new IllegalArgumentException("archivist.retrieval.pool-size must be >= 1");
    }
  }
}
