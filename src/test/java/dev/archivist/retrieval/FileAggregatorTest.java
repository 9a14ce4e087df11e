package dev.archivist.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.archivist.access.AccessProperties;
import dev.archivist.access.FilenameNormalizer;
import dev.archivist.fixture.CandidateBuilder;
import dev.archivist.search.Candidate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FileAggregatorTest {

  private final FileAggregator aggregator =
      new FileAggregator(
          new FilenameNormalizer(new AccessProperties(List.of("temp_"), List.of(), Map.of())));

  @Test
  void groupsByFileAndScoresFileByBestChunk() {
    List<Candidate> chunks =
        List.of(
            chunk("a1", "a.md", 0.9, 0),
            chunk("b1", "b.md", 0.8, 1),
            chunk("a2", "a.md", 0.6, 2));

    FileAggregator.Aggregation aggregation = aggregator.aggregate(chunks, 5, 5);

    assertThat(aggregation.files()).extracting(FileAggregate::fileName).containsExactly("a.md", "b.md");
    FileAggregate a = aggregation.files().get(0);
    assertThat(a.score()).isEqualTo(0.9);
    assertThat(a.chunks()).extracting(Candidate::chunkId).containsExactly("a1", "a2");
    // (0.9^2 + 0.6^2) / (0.9 + 0.6)
    assertThat(a.relevance()).isCloseTo(0.78, within(1e-9));
    assertThat(aggregation.truncated()).isFalse();
  }

  @Test
  void keepsAtMostMaxChunksPerFile() {
    List<Candidate> chunks =
        List.of(
            chunk("c1", "a.md", 0.5, 0),
            chunk("c2", "a.md", 0.9, 1),
            chunk("c3", "a.md", 0.7, 2));

    FileAggregate file = aggregator.aggregate(chunks, 5, 2).files().get(0);

    assertThat(file.chunks()).extracting(Candidate::chunkId).containsExactly("c2", "c3");
  }

  @Test
  void truncatesToKFilesAndFlagsIt() {
    List<Candidate> chunks =
        List.of(
            chunk("a", "a.md", 0.9, 0), chunk("b", "b.md", 0.8, 1), chunk("c", "c.md", 0.7, 2));

    FileAggregator.Aggregation aggregation = aggregator.aggregate(chunks, 2, 5);

    assertThat(aggregation.files()).extracting(FileAggregate::fileName).containsExactly("a.md", "b.md");
    assertThat(aggregation.truncated()).isTrue();
  }

  @Test
  void equalFileScoresOrderByName() {
    List<Candidate> chunks =
        List.of(chunk("z", "zeta.md", 0.5, 0), chunk("a", "alpha.md", 0.5, 1));

    assertThat(aggregator.aggregate(chunks, 5, 5).files())
        .extracting(FileAggregate::fileName)
        .containsExactly("alpha.md", "zeta.md");
  }

  @Test
  void equalChunkScoresPreferShorterTextThenInputOrder() {
    Candidate longer = new CandidateBuilder().id("long").text("a longer passage").file("a.md").scored(0.5, 0);
    Candidate first = new CandidateBuilder().id("first").text("short").file("a.md").scored(0.5, 1);
    Candidate second = new CandidateBuilder().id("second").text("short").file("a.md").scored(0.5, 2);

    FileAggregate file = aggregator.aggregate(List.of(longer, first, second), 5, 5).files().get(0);

    assertThat(file.chunks()).extracting(Candidate::chunkId).containsExactly("first", "second", "long");
  }

  @Test
  void temporaryAndPathVariantsGroupTogetherUnderDisplayName() {
    List<Candidate> chunks =
        List.of(chunk("c1", "uploads/temp_Policies.md", 0.8, 0), chunk("c2", "Policies.md", 0.6, 1));

    FileAggregator.Aggregation aggregation = aggregator.aggregate(chunks, 5, 5);

    assertThat(aggregation.files()).singleElement().satisfies(f -> {
      assertThat(f.fileName()).isEqualTo("Policies.md");
      assertThat(f.chunks()).hasSize(2);
    });
  }

  @Test
  void zeroScoresGiveZeroRelevance() {
    assertThat(FileAggregator.weightedRelevance(List.of(chunk("c", "a.md", 0.0, 0)))).isZero();
  }

  private static Candidate chunk(String id, String file, double score, int sequence) {
    return new CandidateBuilder().id(id).text("text of " + id).file(file).scored(score, sequence);
  }
}
