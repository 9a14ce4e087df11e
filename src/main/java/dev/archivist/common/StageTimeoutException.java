package dev.archivist.common;

import java.time.Duration;

/** A stage did not finish within its time budget. */
public class StageTimeoutException extends RetrievalException {

  public StageTimeoutException(String stage, Duration timeout) {
    super("Stage '%s' timed out after %d ms".formatted(stage, timeout.toMillis()));
  }
}
