package dev.archivist.embedding;

import dev.archivist.common.ContentHasher;

/**
 * Identity of a cached embedding: the model that produced it and a hash of the embedded text.
 *
 * @param modelId identifier of the embedding model
 * @param hash SHA-256 of {@code modelId + ":" + text}
 */
public record CacheKey(String modelId, String hash) {

  public static CacheKey of(String modelId, String text) {
    return new CacheKey(modelId, ContentHasher.sha256(modelId + ":" + text));
  }
}
