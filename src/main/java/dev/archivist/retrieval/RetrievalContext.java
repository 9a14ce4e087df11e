package dev.archivist.retrieval;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request state shared between the caller and the orchestrator: the trace and a cancellation
 * switch.
 *
 * <p>{@link #cancel()} may be called from any thread. Futures registered after cancellation are
 * cancelled immediately.
 */
public class RetrievalContext {

  private final RetrievalTrace trace;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();

  public RetrievalContext(Clock clock) {
    this.trace = new RetrievalTrace(clock);
  }

  public RetrievalTrace trace() {
    return trace;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Cancels the request and interrupts every in-flight stage. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      inFlight.forEach(future -> future.cancel(true));
    }
  }

  void register(Future<?> future) {
    inFlight.add(future);
    if (cancelled.get()) {
      future.cancel(true);
    }
  }

  void release(Future<?> future) {
    inFlight.remove(future);
  }
}
