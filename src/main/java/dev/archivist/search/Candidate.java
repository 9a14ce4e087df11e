package dev.archivist.search;

import dev.archivist.common.ContentHasher;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A retrieved chunk travelling through one request.
 *
 * <p>Identity, text, source file and metadata are fixed at creation. Scores start at zero and are
 * filled in by later stages: {@link HybridCombiner} sets the vector, keyword and combined scores,
 * {@link RerankerService} the rerank and final scores. Instances are confined to a single request
 * and never persisted.
 */
public final class Candidate {

  /** Metadata key holding the source file name. */
  public static final String FILENAME_KEY = "filename";

  /** Fallback metadata key holding the source path; its base name is used as file name. */
  public static final String SOURCE_KEY = "source";

  private final String chunkId;
  private final String text;
  private final @Nullable String sourceFile;
  private final Map<String, Object> metadata;
  private final String contentHash;

  private double vectorScore;
  private double keywordScore;
  private double combinedScore;
  private @Nullable Double rerankScore;
  private double finalScore;
  private int sequence;

  public Candidate(String chunkId, String text, Map<String, ?> metadata) {
    this.chunkId = Objects.requireNonNull(chunkId, "chunkId");
    this.text = Objects.requireNonNull(text, "text");
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    this.sourceFile = resolveSourceFile(this.metadata);
    this.contentHash = ContentHasher.normalizedSha256(text);
  }

  static @Nullable String resolveSourceFile(Map<String, Object> metadata) {
    Object filename = metadata.get(FILENAME_KEY);
    if (filename != null && !filename.toString().isBlank()) {
      return filename.toString();
    }
    Object source = metadata.get(SOURCE_KEY);
    if (source != null && !source.toString().isBlank()) {
      String path = source.toString().replace('\\', '/');
      String base = path.substring(path.lastIndexOf('/') + 1);
      return base.isBlank() ? null : base;
    }
    return null;
  }

  public String chunkId() {
    return chunkId;
  }

  public String text() {
    return text;
  }

  /** Source file name from metadata, or null when the chunk carries none. */
  public @Nullable String sourceFile() {
    return sourceFile;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public String contentHash() {
    return contentHash;
  }

  public double vectorScore() {
    return vectorScore;
  }

  public double keywordScore() {
    return keywordScore;
  }

  public double combinedScore() {
    return combinedScore;
  }

  public @Nullable Double rerankScore() {
    return rerankScore;
  }

  /** Score used for ranking after all stages: the reranked blend, or the combined score. */
  public double finalScore() {
    return finalScore;
  }

  /** Position at which the candidate entered fusion; the last tie-breaker. */
  public int sequence() {
    return sequence;
  }

  public Candidate withVectorScore(double score) {
    this.vectorScore = score;
    return this;
  }

  public Candidate withKeywordScore(double score) {
    this.keywordScore = score;
    return this;
  }

  /** Sets {@code combined = alpha * vector + (1 - alpha) * keyword}; final starts equal to it. */
  public void combine(double alpha, int sequence) {
    this.combinedScore = alpha * vectorScore + (1.0 - alpha) * keywordScore;
    this.finalScore = combinedScore;
    this.sequence = sequence;
  }

  /** Sets {@code final = weight * rerank + (1 - weight) * combined}. */
  public void applyRerank(double score, double weight) {
    this.rerankScore = score;
    this.finalScore = weight * score + (1.0 - weight) * combinedScore;
  }

  @Override
  public String toString() {
    return "Candidate[" + chunkId + ", file=" + sourceFile + ", final=" + finalScore + "]";
  }
}
