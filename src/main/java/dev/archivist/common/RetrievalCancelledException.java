package dev.archivist.common;

/** The caller cancelled the request while a stage was still running. */
public class RetrievalCancelledException extends RetrievalException {

  public RetrievalCancelledException(String stage) {
    super("Retrieval cancelled during stage '" + stage + "'");
  }
}
