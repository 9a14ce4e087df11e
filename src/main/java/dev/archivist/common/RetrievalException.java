package dev.archivist.common;

/**
 * Base type for recoverable failures raised by a single retrieval stage.
 *
 * <p>Stages never let these escape to the caller directly: they are carried inside a {@link
 * StageOutcome} so the orchestrator can decide between degrading and failing the request.
 */
public class RetrievalException extends RuntimeException {

  public RetrievalException(String message) {
    super(message);
  }

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
