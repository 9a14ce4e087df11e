package dev.archivist.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.BaseIntegrationTest;
import dev.archivist.query.SearchMode;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(
    properties = {
      "archivist.access.admins=root",
      "archivist.access.grants.alice=policies.md,handbook.pdf",
      "archivist.access.grants.bob=handbook.pdf"
    })
class HybridRetrievalIT extends BaseIntegrationTest {

  @Autowired RetrievalOrchestrator orchestrator;

  @Autowired EmbeddingModel embeddingModel;

  @BeforeEach
  void seed() {
    seed(
        "Refunds are issued within 30 days of purchase when the item is returned unused.",
        "policies.md",
        "md");
    seed(
        "Salary bands for 2024 are reviewed each quarter by the compensation committee.",
        "temp_salaries.md",
        "md");
    seed(
        "New employees receive a laptop and a badge on their first day.",
        "handbook.pdf",
        "pdf");
  }

  private void seed(String text, String filename, String type) {
    TextSegment segment =
        TextSegment.from(text, Metadata.from("filename", filename).put("type", type));
    Embedding embedding = embeddingModel.embed(segment).content();
    embeddingStore.add(embedding, segment);
  }

  @Test
  void hybridRetrievalReturnsOnlyAuthorizedFiles() {
    RetrievalResponse response =
        orchestrator.retrieve(new RetrievalRequest("refund policy salary", "alice", 5));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files()).extracting(FileAggregate::fileName).contains("policies.md");
    assertThat(response.files())
        .extracting(FileAggregate::fileName)
        .doesNotContain("salaries.md", "temp_salaries.md");
    assertThat(response.trace().stages()).last().isEqualTo(RetrievalStage.DONE);
  }

  @Test
  void userWithoutMatchingGrantsGetsNoAccessibleResults() {
    RetrievalResponse response =
        orchestrator.retrieve(
            new RetrievalRequest("salary bands", "bob", 5, SearchMode.KEYWORD, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.NO_ACCESSIBLE_RESULTS);
    assertThat(response.files()).isEmpty();
  }

  @Test
  void adminSeesTemporaryUploadsUnderTheirDisplayName() {
    RetrievalResponse response =
        orchestrator.retrieve(
            new RetrievalRequest("salary bands", "root", 5, SearchMode.KEYWORD, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files().get(0).fileName()).isEqualTo("salaries.md");
  }

  @Test
  void inlineFilterRestrictsVectorBranch() {
    RetrievalResponse response =
        orchestrator.retrieve(
            new RetrievalRequest("first day equipment type:pdf", "root", 5, SearchMode.VECTOR, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files()).extracting(FileAggregate::fileName).containsOnly("handbook.pdf");
  }

  @Test
  void keywordModeMatchesExactTerms() {
    RetrievalResponse response =
        orchestrator.retrieve(
            new RetrievalRequest("laptop badge", "alice", 5, SearchMode.KEYWORD, null));

    assertThat(response.status()).isEqualTo(RetrievalStatus.OK);
    assertThat(response.files().get(0).fileName()).isEqualTo("handbook.pdf");
    assertThat(response.files().get(0).score()).isGreaterThan(0.0);
  }
}
