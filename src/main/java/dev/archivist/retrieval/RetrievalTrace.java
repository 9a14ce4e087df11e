package dev.archivist.retrieval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured telemetry of one retrieval: visited stages, per-step spans and degradation notes.
 *
 * <p>The snapshot is returned to the caller, so it must not reveal anything about content the
 * caller may not read. Steps that run before access filtering are recorded with {@link #span},
 * which logs the item count at DEBUG and leaves it out of the snapshot; only steps working on
 * filtered content use {@link #filteredSpan}. Degradation notes are fixed category strings.
 *
 * <p>Branch spans are recorded from worker threads, so all mutators are synchronized.
 */
public class RetrievalTrace {

  private static final Logger log = LoggerFactory.getLogger(RetrievalTrace.class);

  private final Clock clock;
  private final Instant startedAt;
  private final List<RetrievalStage> stages = new ArrayList<>();
  private final List<StageSpan> spans = new ArrayList<>();
  private final List<String> degradations = new ArrayList<>();

  public RetrievalTrace(Clock clock) {
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public Instant now() {
    return clock.instant();
  }

  public synchronized void enter(RetrievalStage stage) {
    stages.add(stage);
  }

  public synchronized RetrievalStage currentStage() {
    return stages.isEmpty() ? RetrievalStage.PARSED : stages.get(stages.size() - 1);
  }

  /** Records a step over unfiltered content; the item count stays in the server log. */
  public synchronized void span(String name, Instant start, int itemCount, String outcome) {
    Duration duration = Duration.between(start, clock.instant());
    log.debug("Step {} {} with {} items in {}ms", name, outcome, itemCount, duration.toMillis());
    spans.add(new StageSpan(name, duration, null, outcome));
  }

  /** Records a step over access-filtered content, keeping its item count in the snapshot. */
  public synchronized void filteredSpan(
      String name, Instant start, int itemCount, String outcome) {
    spans.add(new StageSpan(name, Duration.between(start, clock.instant()), itemCount, outcome));
  }

  public synchronized void degrade(String note) {
    degradations.add(note);
  }

  public synchronized TraceSummary snapshot() {
    return new TraceSummary(
        List.copyOf(stages),
        List.copyOf(spans),
        List.copyOf(degradations),
        Duration.between(startedAt, clock.instant()));
  }

  /**
   * Immutable view of a trace, returned in the response envelope.
   *
   * @param stages visited states in order
   * @param spans per-step timings
   * @param degradations human-readable notes on skipped or failed optional steps
   * @param total elapsed time
   */
  public record TraceSummary(
      List<RetrievalStage> stages,
      List<StageSpan> spans,
      List<String> degradations,
      Duration total) {}
}
