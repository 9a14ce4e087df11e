package dev.archivist.search;

import dev.archivist.common.RetrievalException;

/** Cross-encoder scoring failed; the fused ranking is used instead. Never fatal. */
public class RerankUnavailableException extends RetrievalException {

  public RerankUnavailableException(String message) {
    super(message);
  }

  public RerankUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
