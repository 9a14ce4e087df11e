package dev.archivist.document;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.BaseIntegrationTest;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class DocumentChunkRepositoryIT extends BaseIntegrationTest {

  @Autowired DocumentChunkRepository repository;

  @Autowired EmbeddingModel embeddingModel;

  @BeforeEach
  void seed() {
    seed("Refund requests are reviewed weekly.");
    seed("Refund refund refund: every refund needs a receipt and a refund form.");
    seed("Shipping is free above fifty euros.");
    seed("A refund is issued after the refund form is approved.");
  }

  private void seed(String text) {
    TextSegment segment = TextSegment.from(text, Metadata.from("filename", "policies.md"));
    embeddingStore.add(embeddingModel.embed(segment).content(), segment);
  }

  @Test
  void windowKeepsDensestMatchesFirst() {
    List<Object[]> rows = repository.findKeywordCandidates("refund", 2);

    assertThat(rows).hasSize(2);
    assertThat((String) rows.get(0)[1]).startsWith("Refund refund refund");
    assertThat((String) rows.get(1)[1]).startsWith("A refund is issued");
  }

  @Test
  void windowIsStableAcrossCalls() {
    List<String> first = texts(repository.findKeywordCandidates("refund | receipt", 3));

    for (int i = 0; i < 5; i++) {
      assertThat(texts(repository.findKeywordCandidates("refund | receipt", 3))).isEqualTo(first);
    }
  }

  private static List<String> texts(List<Object[]> rows) {
    return rows.stream().map(row -> (String) row[1]).toList();
  }
}
