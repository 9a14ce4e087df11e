package dev.archivist.embedding;

import java.util.Optional;

/**
 * Backing store for {@link EmbeddingCache}. Implementations must tolerate concurrent access on
 * distinct keys and must hand out copies, never their internal arrays.
 */
public interface EmbeddingCacheStore {

  Optional<float[]> get(CacheKey key);

  /** Stores a vector. Writing the same key twice keeps a single entry. */
  void put(CacheKey key, float[] vector);

  /** Approximate number of stored entries. */
  long size();
}
