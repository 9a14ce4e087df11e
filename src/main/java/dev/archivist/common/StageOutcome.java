package dev.archivist.common;

import java.util.Optional;

/**
 * Result of one pipeline stage: either a value or the {@link RetrievalException} that prevented
 * it.
 *
 * <p>Stages return outcomes instead of throwing so that every degradation path is visible in the
 * orchestrator's signature rather than hidden in a catch block.
 *
 * @param <T> the stage's output type
 */
public sealed interface StageOutcome<T> permits StageOutcome.Success, StageOutcome.Failure {

  static <T> StageOutcome<T> success(T value) {
    return new Success<>(value);
  }

  static <T> StageOutcome<T> failure(RetrievalException error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  /** Returns the value on success, otherwise {@code fallback}. */
  T valueOr(T fallback);

  /** Returns the failure cause, or empty on success. */
  Optional<RetrievalException> error();

  record Success<T>(T value) implements StageOutcome<T> {

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T valueOr(T fallback) {
      return value;
    }

    @Override
    public Optional<RetrievalException> error() {
      return Optional.empty();
    }
  }

  record Failure<T>(RetrievalException cause) implements StageOutcome<T> {

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T valueOr(T fallback) {
      return fallback;
    }

    @Override
    public Optional<RetrievalException> error() {
      return Optional.of(cause);
    }
  }
}
