package dev.archivist.search;

import dev.archivist.common.StageOutcome;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking of the head of the fused ranking, using an ONNX-based scoring model
 * (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Reranking is split in two steps so the model call can run on a worker thread under a timeout
 * while candidates are only ever mutated by the request thread: {@link #scoreTop} computes the
 * cross-encoder scores, {@link #applyScores} blends them in. The scoring model is optional; when
 * none is configured the stage reports itself as disabled.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final Optional<ScoringModel> scoringModel;
  private final SearchProperties properties;

  public RerankerService(Optional<ScoringModel> scoringModel, SearchProperties properties) {
    this.scoringModel = scoringModel;
    this.properties = properties;
  }

  public boolean isEnabled() {
    return scoringModel.isPresent();
  }

  /** Number of leading candidates sent to the cross-encoder for a request of {@code k} files. */
  public int headSize(int k) {
    return k * properties.getRerankFactor();
  }

  /**
   * Scores (query, passage) pairs for the given head in one batch.
   *
   * @param query the search text
   * @param head the leading candidates of the fused ranking
   * @return one score per candidate, in head order, or {@link RerankUnavailableException}
   */
  public StageOutcome<List<Double>> scoreTop(String query, List<Candidate> head) {
    if (scoringModel.isEmpty()) {
      return StageOutcome.failure(new RerankUnavailableException("No cross-encoder configured"));
    }
    if (head.isEmpty()) {
      return StageOutcome.success(List.of());
    }

    List<TextSegment> segments = head.stream().map(c -> TextSegment.from(c.text())).toList();
    Response<List<Double>> response;
    try {
      response = scoringModel.get().scoreAll(segments, query);
    } catch (RuntimeException e) {
      return StageOutcome.failure(
          new RerankUnavailableException("Cross-encoder scoring failed: " + e.getMessage(), e));
    }

    List<Double> scores = response == null ? null : response.content();
    if (scores == null || scores.size() != head.size()) {
      return StageOutcome.failure(
          new RerankUnavailableException(
              "Cross-encoder returned "
                  + (scores == null ? 0 : scores.size())
                  + " scores for "
                  + head.size()
                  + " passages"));
    }
    if (!properties.isRerankSigmoid()) {
      return StageOutcome.success(List.copyOf(scores));
    }
    return StageOutcome.success(scores.stream().map(RerankerService::sigmoid).toList());
  }

  /**
   * Blends cross-encoder scores into the head of the ranking.
   *
   * <p>The first {@code scores.size()} candidates get {@code final = w * rerank + (1 - w) *
   * combined} and are reordered by final score; the remaining candidates keep {@code final =
   * combined} and follow the reranked block in their existing order.
   *
   * @param ranked the fused ranking
   * @param scores scores for the leading candidates, as returned by {@link #scoreTop}
   * @return the new ranking
   */
  public List<Candidate> applyScores(List<Candidate> ranked, List<Double> scores) {
    int headSize = Math.min(scores.size(), ranked.size());
    List<Candidate> head = new ArrayList<>(ranked.subList(0, headSize));
    for (int i = 0; i < headSize; i++) {
      head.get(i).applyRerank(scores.get(i), properties.getRerankWeight());
    }
    head.sort(
        Comparator.comparingDouble(Candidate::finalScore)
            .reversed()
            .thenComparing(HybridCombiner.RANKING));

    List<Candidate> result = new ArrayList<>(ranked.size());
    result.addAll(head);
    result.addAll(ranked.subList(headSize, ranked.size()));
    log.debug("Reranked {} of {} candidates", headSize, ranked.size());
    return result;
  }

  static double sigmoid(double logit) {
    return 1.0 / (1.0 + Math.exp(-logit));
  }
}
