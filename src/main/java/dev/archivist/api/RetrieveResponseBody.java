package dev.archivist.api;

import dev.archivist.retrieval.FileAggregate;
import dev.archivist.retrieval.RetrievalResponse;
import dev.archivist.retrieval.RetrievalStatus;
import dev.archivist.retrieval.RetrievalTrace;
import java.util.List;

/** JSON body returned by {@code POST /api/retrieve}. */
public record RetrieveResponseBody(
    RetrievalStatus status,
    String message,
    List<FileResult> files,
    boolean truncated,
    RetrievalTrace.TraceSummary trace) {

  static RetrieveResponseBody from(RetrievalResponse response) {
    return new RetrieveResponseBody(
        response.status(),
        response.message(),
        response.files().stream().map(FileResult::from).toList(),
        response.truncated(),
        response.trace());
  }

  public record FileResult(
      String fileName, double score, double relevance, List<ChunkResult> chunks) {

    static FileResult from(FileAggregate file) {
      return new FileResult(
          file.fileName(),
          file.score(),
          file.relevance(),
          file.chunks().stream().map(c -> new ChunkResult(c.text(), c.finalScore())).toList());
    }
  }

  public record ChunkResult(String text, double score) {}
}
