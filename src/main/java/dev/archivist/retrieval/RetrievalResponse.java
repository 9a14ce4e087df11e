package dev.archivist.retrieval;

import java.util.List;

/**
 * Result envelope of a retrieval.
 *
 * @param status outcome class
 * @param message user-facing message; empty for {@link RetrievalStatus#OK}
 * @param files ranked files, empty unless {@code OK}
 * @param truncated whether files beyond {@code k} were cut
 * @param trace stage telemetry
 */
public record RetrievalResponse(
    RetrievalStatus status,
    String message,
    List<FileAggregate> files,
    boolean truncated,
    RetrievalTrace.TraceSummary trace) {

  public RetrievalResponse {
    files = List.copyOf(files);
  }

  static RetrievalResponse of(RetrievalStatus status, RetrievalTrace trace) {
    return new RetrievalResponse(status, status.defaultMessage(), List.of(), false, trace.snapshot());
  }
}
