package dev.archivist.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A chunk of an ingested document as stored in pgvector.
 *
 * <p>Rows are written by the (external) ingestion pipeline through LangChain4j's {@code
 * PgVectorEmbeddingStore}; this mapping is read-only and exists for the keyword candidate queries
 * in {@link DocumentChunkRepository}. The embedding column is not mapped.
 *
 * <p>Maps to the {@code document_chunks} table managed by Flyway migrations.
 */
@Entity
@Table(name = "document_chunks")
public class DocumentChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSON")
  private String metadata;

  @Column(name = "created_at", insertable = false, updatable = false)
  private Instant createdAt;

  protected DocumentChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
