package dev.archivist.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryEmbeddingCacheStoreTest {

  @Test
  void returnedVectorsAreDefensiveCopies() {
    InMemoryEmbeddingCacheStore store = new InMemoryEmbeddingCacheStore(100);
    CacheKey key = CacheKey.of("m", "t");
    float[] original = {1f, 2f};
    store.put(key, original);

    original[0] = 42f;
    store.get(key).orElseThrow()[1] = 42f;

    assertThat(store.get(key)).hasValueSatisfying(v -> assertThat(v).containsExactly(1f, 2f));
  }

  @Test
  void boundedByTotalVectorComponents() {
    InMemoryEmbeddingCacheStore store = new InMemoryEmbeddingCacheStore(8);
    for (int i = 0; i < 10; i++) {
      store.put(CacheKey.of("m", "text-" + i), new float[4]);
    }

    assertThat(store.size()).isLessThanOrEqualTo(2);
  }

  @Test
  void keyDependsOnModelAndText() {
    assertThat(CacheKey.of("m1", "t")).isEqualTo(CacheKey.of("m1", "t"));
    assertThat(CacheKey.of("m1", "t")).isNotEqualTo(CacheKey.of("m2", "t"));
    assertThat(CacheKey.of("m1", "t").hash()).hasSize(64);
  }
}
