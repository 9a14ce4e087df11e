package dev.archivist.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Memoizes text embeddings keyed by (model, text) and batches cache misses into a single
 * embedding-model call.
 *
 * <p>Concurrent callers that need the same key while it is being computed wait on that single
 * computation instead of issuing their own (singleflight). The in-flight map is the only lock-like
 * structure and nothing is held while the model runs. Vectors computed for a caller that has since
 * been cancelled are still written to the store.
 */
@Component
public class EmbeddingCache {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingCacheStore store;
  private final String modelId;

  private final ConcurrentHashMap<CacheKey, CompletableFuture<float[]>> inFlight =
      new ConcurrentHashMap<>();

  public EmbeddingCache(
      EmbeddingModel embeddingModel, EmbeddingCacheStore store, EmbeddingProperties properties) {
    this.embeddingModel = embeddingModel;
    this.store = store;
    this.modelId = properties.modelId();
  }

  /**
   * Looks up a cached vector.
   *
   * @param modelId the model that produced the vector
   * @param text the embedded text
   * @return the vector, or empty on a miss
   */
  public Optional<float[]> get(String modelId, String text) {
    return store.get(CacheKey.of(modelId, text));
  }

  /** Stores a vector for (model, text). Re-putting the same key overwrites it. */
  public void put(String modelId, String text, float[] vector) {
    store.put(CacheKey.of(modelId, text), vector);
  }

  /** Embeds a single text with the configured model, through the cache. */
  public float[] embed(String text) {
    return embedAll(List.of(text)).get(0);
  }

  /**
   * Embeds a batch with the configured model. Cached vectors are returned as-is, misses go to the
   * model in one call, and the merged result keeps the order of {@code texts}.
   *
   * @param texts texts to embed; duplicates are embedded once
   * @return one vector per input text, same order
   * @throws EmbeddingFailureException if the model call fails or returns the wrong number of
   *     vectors, or the calling thread is interrupted while waiting on another caller's batch
   */
  public List<float[]> embedAll(List<String> texts) {
    int size = texts.size();
    float[][] vectors = new float[size][];
    CacheKey[] keys = new CacheKey[size];
    Map<CacheKey, String> owned = new LinkedHashMap<>();
    Map<CacheKey, CompletableFuture<float[]>> pending = new LinkedHashMap<>();
    int hits = 0;

    for (int i = 0; i < size; i++) {
      CacheKey key = CacheKey.of(modelId, texts.get(i));
      keys[i] = key;
      if (pending.containsKey(key)) {
        continue;
      }
      Optional<float[]> cached = store.get(key);
      if (cached.isPresent()) {
        vectors[i] = cached.get();
        hits++;
        continue;
      }
      CompletableFuture<float[]> mine = new CompletableFuture<>();
      CompletableFuture<float[]> existing = inFlight.putIfAbsent(key, mine);
      if (existing != null) {
        pending.put(key, existing);
        continue;
      }
      // Another caller may have finished between the store lookup and claiming the key
      Optional<float[]> raced = store.get(key);
      if (raced.isPresent()) {
        mine.complete(raced.get());
        inFlight.remove(key, mine);
        vectors[i] = raced.get();
        hits++;
        continue;
      }
      owned.put(key, texts.get(i));
      pending.put(key, mine);
    }

    log.debug(
        "Embedding batch of {}: {} cached, {} to compute, {} awaited from other callers",
        size,
        hits,
        owned.size(),
        pending.size() - owned.size());

    if (!owned.isEmpty()) {
      computeOwned(owned, pending);
    }

    List<float[]> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      result.add(vectors[i] != null ? vectors[i] : await(pending.get(keys[i])));
    }
    return result;
  }

  private void computeOwned(
      Map<CacheKey, String> owned, Map<CacheKey, CompletableFuture<float[]>> pending) {
    List<TextSegment> segments = owned.values().stream().map(TextSegment::from).toList();
    List<Embedding> embeddings;
    try {
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      embeddings = response.content();
      if (embeddings == null || embeddings.size() != segments.size()) {
        throw new EmbeddingFailureException(
            "Embedding model returned %d vectors for %d texts"
                .formatted(embeddings == null ? 0 : embeddings.size(), segments.size()));
      }
    } catch (EmbeddingFailureException e) {
      failOwned(owned, pending, e);
      throw e;
    } catch (RuntimeException e) {
      EmbeddingFailureException failure =
          new EmbeddingFailureException("Embedding model call failed: " + e.getMessage(), e);
      failOwned(owned, pending, failure);
      throw failure;
    }

    Map<CacheKey, float[]> computed = new LinkedHashMap<>();
    int index = 0;
    for (CacheKey key : owned.keySet()) {
      float[] vector = embeddings.get(index++).vector();
      computed.put(key, vector);
      pending.get(key).complete(vector);
    }
    // Waiters already have their vectors; a store failure only costs a later recomputation
    try {
      computed.forEach(store::put);
    } catch (RuntimeException e) {
      log.warn("Failed to persist {} embeddings: {}", computed.size(), e.getMessage());
    } finally {
      computed.keySet().forEach(key -> inFlight.remove(key, pending.get(key)));
    }
  }

  private void failOwned(
      Map<CacheKey, String> owned,
      Map<CacheKey, CompletableFuture<float[]>> pending,
      EmbeddingFailureException failure) {
    for (CacheKey key : owned.keySet()) {
      CompletableFuture<float[]> future = pending.get(key);
      future.completeExceptionally(failure);
      inFlight.remove(key, future);
    }
  }

  private static float[] await(CompletableFuture<float[]> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingFailureException("Interrupted while waiting for a shared embedding", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof EmbeddingFailureException failure) {
        throw failure;
      }
      throw new EmbeddingFailureException("Shared embedding computation failed", e.getCause());
    }
  }

  /** Number of entries currently held by the backing store. */
  public long size() {
    return store.size();
  }

  public String modelId() {
    return modelId;
  }
}
