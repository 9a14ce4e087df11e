package dev.archivist.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;

/**
 * Caffeine-backed store bounded by the total number of vector components held, so the memory
 * ceiling does not depend on the embedding dimension. Least-recently-used entries are evicted
 * first.
 */
public class InMemoryEmbeddingCacheStore implements EmbeddingCacheStore {

  private final Cache<CacheKey, float[]> cache;

  public InMemoryEmbeddingCacheStore(long maxVectorFloats) {
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxVectorFloats)
            .weigher((CacheKey key, float[] vector) -> Math.max(1, vector.length))
            .build();
  }

  @Override
  public Optional<float[]> get(CacheKey key) {
    float[] vector = cache.getIfPresent(key);
    return vector == null ? Optional.empty() : Optional.of(vector.clone());
  }

  @Override
  public void put(CacheKey key, float[] vector) {
    cache.put(key, vector.clone());
  }

  @Override
  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
