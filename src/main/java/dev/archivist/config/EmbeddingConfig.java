package dev.archivist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.embedding.EmbeddingCacheStore;
import dev.archivist.embedding.EmbeddingProperties;
import dev.archivist.embedding.FileEmbeddingCacheStore;
import dev.archivist.embedding.InMemoryEmbeddingCacheStore;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Configures the embedding model, embedding cache store, cross-encoder and vector store beans.
 *
 * <p>The embedding model is the in-process ONNX bge-small-en-v1.5 quantized model (384
 * dimensions). The {@link PgVectorEmbeddingStore} reads the Flyway-managed {@code document_chunks}
 * table through the application's HikariCP {@link DataSource}.
 *
 * @see dev.archivist.search.VectorSearcher
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Selects the embedding cache backing store from {@code archivist.embedding.cache.store}.
     *
     * @param properties embedding settings
     * @param objectMapper Jackson mapper for the on-disk format
     * @return a Caffeine-backed store for {@code memory}, a JSON file store for {@code disk}
     */
    @Bean
    public EmbeddingCacheStore embeddingCacheStore(
            EmbeddingProperties properties, ObjectMapper objectMapper) {
        EmbeddingProperties.Cache cache = properties.cache();
        return switch (cache.store()) {
            case "memory" -> new InMemoryEmbeddingCacheStore(cache.maxVectorFloats());
            case "disk" -> {
                log.info("Embedding cache persisted under {}", cache.directory());
                yield new FileEmbeddingCacheStore(Path.of(cache.directory()), objectMapper);
            }
            default -> throw new IllegalStateException(
                    "archivist.embedding.cache.store must be 'memory' or 'disk', got '"
                            + cache.store() + "'");
        };
    }

    /**
     * Provides the in-process ONNX cross-encoder (ms-marco-MiniLM-L-6-v2) for reranking. Only
     * created when a model path is configured; without it reranking is skipped.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a ready-to-use scoring model for cross-encoder reranking
     */
    @Bean
    @ConditionalOnProperty(prefix = "archivist.reranker", name = "model-path")
    public ScoringModel scoringModel(
            @Value("${archivist.reranker.model-path}") String modelPath,
            @Value("${archivist.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }

    /**
     * Configures the pgvector embedding store.
     *
     * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex}
     * are disabled to avoid conflicts.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param properties embedding settings providing the vector dimension
     * @return an embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource, EmbeddingProperties properties) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table("document_chunks")
                .dimension(properties.dimension())
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)    // HNSW index managed by Flyway V1
                .build();
    }
}
