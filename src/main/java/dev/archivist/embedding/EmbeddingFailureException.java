package dev.archivist.embedding;

import dev.archivist.common.RetrievalException;

/** The embedding model rejected or failed a batch. Failures are per batch, not per text. */
public class EmbeddingFailureException extends RetrievalException {

  public EmbeddingFailureException(String message) {
    super(message);
  }

  public EmbeddingFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
