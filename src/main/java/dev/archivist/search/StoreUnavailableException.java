package dev.archivist.search;

import dev.archivist.common.RetrievalException;

/** The vector store or the chunk table could not be queried. */
public class StoreUnavailableException extends RetrievalException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
