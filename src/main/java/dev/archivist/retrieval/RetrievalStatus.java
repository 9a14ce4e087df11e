package dev.archivist.retrieval;

/** Outcome class of a retrieval, with the user-facing message for each. */
public enum RetrievalStatus {
  OK(""),
  NO_RESULTS("No matching content was found for this query."),
  NO_ACCESSIBLE_RESULTS("No content you're authorized to view matches this query."),
  FAILED("Retrieval failed. Please try again.");

  private final String defaultMessage;

  RetrievalStatus(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
