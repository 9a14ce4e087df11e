package dev.archivist.retrieval;

import dev.archivist.search.Candidate;
import java.util.List;

/**
 * Retained chunks of one source file.
 *
 * @param fileName display name of the file
 * @param chunks retained chunks, best first
 * @param score final score of the best chunk
 * @param relevance score-weighted mean of the retained chunk scores
 */
public record FileAggregate(String fileName, List<Candidate> chunks, double score, double relevance) {

  public FileAggregate {
    chunks = List.copyOf(chunks);
  }
}
