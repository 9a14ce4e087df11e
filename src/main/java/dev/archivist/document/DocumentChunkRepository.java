package dev.archivist.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link DocumentChunk} rows. */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Returns the lexical candidate window for a query: chunks containing at least one of the
   * query's terms, found through the {@code simple} full-text GIN index. When more rows match
   * than fit, the window keeps the densest matches by {@code ts_rank_cd}, ties broken by id, so the
   * same query always sees the same window. Final BM25 ranking is done in Java.
   *
   * <p>Each row is {@code [embedding_id, text, metadata]} with the id and metadata cast to text.
   *
   * @param tsQuery terms joined with {@code " | "}; callers must pass only letters and digits
   * @param limit maximum number of rows
   * @return raw rows
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text), text, CAST(metadata AS text)
            FROM document_chunks
            WHERE to_tsvector('simple', coalesce(text, '')) @@ to_tsquery('simple', :tsQuery)
            ORDER BY ts_rank_cd(to_tsvector('simple', coalesce(text, '')),
                                to_tsquery('simple', :tsQuery)) DESC,
                     embedding_id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> findKeywordCandidates(
      @Param("tsQuery") String tsQuery, @Param("limit") int limit);
}
