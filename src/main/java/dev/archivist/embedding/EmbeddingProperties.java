package dev.archivist.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Embedding model and cache settings bound from {@code archivist.embedding.*}.
 *
 * @param modelId identifier stored in cache keys; change it whenever the model changes
 * @param queryPrefix instruction prepended to queries (not documents) before embedding
 * @param dimension vector dimension of the configured model
 * @param cache backing store selection
 */
@ConfigurationProperties(prefix = "archivist.embedding")
public record EmbeddingProperties(
    @DefaultValue("bge-small-en-v1.5-q") String modelId,
    @DefaultValue("") String queryPrefix,
    @DefaultValue("384") int dimension,
    @DefaultValue Cache cache) {

  /**
   * @param store {@code memory} (Caffeine, bounded) or {@code disk} (JSON files)
   * @param directory root directory for the disk store
   * @param maxVectorFloats weight bound of the memory store, in vector components
   */
  public record Cache(
      @DefaultValue("memory") String store,
      @DefaultValue(".embedding-cache") String directory,
      @DefaultValue("50000000") long maxVectorFloats) {}
}
