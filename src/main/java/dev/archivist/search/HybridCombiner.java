package dev.archivist.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility fusing vector and keyword candidates with a convex combination.
 *
 * <p>{@code combined = alpha * vector + (1 - alpha) * keyword}. Both inputs are already on a 0-1
 * scale (cosine similarity and window-normalised BM25), so no further normalisation is applied. A
 * candidate found by one branch only gets 0.0 for the other.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class HybridCombiner {

  /**
   * Total ranking order: combined score descending, vector score descending, shorter text first,
   * then fusion order.
   */
  public static final Comparator<Candidate> RANKING =
      Comparator.comparingDouble(Candidate::combinedScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(Candidate::vectorScore).reversed())
          .thenComparingInt(c -> c.text().length())
          .thenComparingInt(Candidate::sequence);

  private HybridCombiner() {}

  /**
   * Fuses the two branches.
   *
   * <p>Candidates are keyed by chunk id. When both branches return the same chunk, the vector-side
   * instance is kept and receives the keyword score. Fusion order is vector candidates in branch
   * order, then keyword-only candidates in branch order.
   *
   * @param vectorResults candidates from the vector branch
   * @param keywordResults candidates from the keyword branch
   * @param alpha weight of the vector score, in [0, 1]
   * @param minScore candidates whose combined score is below this are dropped
   * @return fused candidates in {@link #RANKING} order
   */
  public static List<Candidate> combine(
      List<Candidate> vectorResults,
      List<Candidate> keywordResults,
      double alpha,
      double minScore) {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
    }
    if (vectorResults.isEmpty() && keywordResults.isEmpty()) {
      return List.of();
    }

    Map<String, Candidate> fused = new LinkedHashMap<>();
    for (Candidate candidate : vectorResults) {
      fused.putIfAbsent(candidate.chunkId(), candidate.withKeywordScore(0.0));
    }
    for (Candidate candidate : keywordResults) {
      Candidate existing = fused.get(candidate.chunkId());
      if (existing != null) {
        existing.withKeywordScore(Math.max(existing.keywordScore(), candidate.keywordScore()));
      } else {
        fused.put(candidate.chunkId(), candidate.withVectorScore(0.0));
      }
    }

    List<Candidate> ranked = new ArrayList<>(fused.size());
    int sequence = 0;
    for (Candidate candidate : fused.values()) {
      candidate.combine(alpha, sequence++);
      if (candidate.combinedScore() >= minScore) {
        ranked.add(candidate);
      }
    }
    ranked.sort(RANKING);
    return ranked;
  }
}
