package dev.archivist.common;

/** The retrieval executor had no capacity left to run a stage. */
public class StageRejectedException extends RetrievalException {

  public StageRejectedException(String stage, Throwable cause) {
    super("Stage '%s' rejected by the retrieval executor".formatted(stage), cause);
  }
}
