package dev.archivist.retrieval;

import dev.archivist.access.FilenameNormalizer;
import dev.archivist.search.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Groups ranked chunks by source file.
 *
 * <p>Within a file, chunks are ordered by final score descending, then shorter text, then input
 * order, and at most {@code maxChunksPerFile} are kept. Files are ordered by their best chunk's
 * score descending, then by name, and cut to {@code k}.
 */
@Component
public class FileAggregator {

  private static final Comparator<Candidate> CHUNK_ORDER =
      Comparator.comparingDouble(Candidate::finalScore)
          .reversed()
          .thenComparingInt(c -> c.text().length());

  private static final Comparator<FileAggregate> FILE_ORDER =
      Comparator.comparingDouble(FileAggregate::score)
          .reversed()
          .thenComparing(FileAggregate::fileName);

  private final FilenameNormalizer normalizer;

  public FileAggregator(FilenameNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  /**
   * Aggregates chunks into files.
   *
   * @param candidates access-filtered chunks in ranked order
   * @param k maximum number of files
   * @param maxChunksPerFile maximum chunks kept per file
   * @return the top files and whether any were cut
   */
  public Aggregation aggregate(List<Candidate> candidates, int k, int maxChunksPerFile) {
    Map<String, List<Candidate>> byFile = new LinkedHashMap<>();
    Map<String, String> displayNames = new LinkedHashMap<>();
    for (Candidate candidate : candidates) {
      String key = normalizer.normalize(candidate.sourceFile());
      if (key == null) {
        continue;
      }
      byFile.computeIfAbsent(key, unused -> new ArrayList<>()).add(candidate);
      displayNames.putIfAbsent(key, normalizer.displayName(candidate.sourceFile()));
    }

    List<FileAggregate> files = new ArrayList<>(byFile.size());
    byFile.forEach(
        (key, chunks) -> {
          // List.sort is stable, so input order breaks the remaining ties
          chunks.sort(CHUNK_ORDER);
          List<Candidate> retained = chunks.subList(0, Math.min(maxChunksPerFile, chunks.size()));
          files.add(
              new FileAggregate(
                  displayNames.get(key),
                  retained,
                  retained.get(0).finalScore(),
                  weightedRelevance(retained)));
        });

    files.sort(FILE_ORDER);
    boolean truncated = files.size() > k;
    return new Aggregation(truncated ? List.copyOf(files.subList(0, k)) : List.copyOf(files), truncated);
  }

  /** Mean of the chunk scores weighted by themselves; 0 when every score is 0. */
  static double weightedRelevance(List<Candidate> chunks) {
    double weighted = 0.0;
    double total = 0.0;
    for (Candidate chunk : chunks) {
      double score = Math.max(0.0, chunk.finalScore());
      weighted += score * score;
      total += score;
    }
    return total == 0.0 ? 0.0 : weighted / total;
  }

  /**
   * Aggregated files.
   *
   * @param files files in rank order, at most {@code k}
   * @param truncated whether more than {@code k} files were found
   */
  public record Aggregation(List<FileAggregate> files, boolean truncated) {}
}
