package dev.archivist.retrieval;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Timing of one pipeline step.
 *
 * @param name step name, e.g. {@code vector} or {@code access-filter}
 * @param duration wall-clock time spent
 * @param itemCount number of items the step produced; null for steps before access filtering
 * @param outcome {@code ok}, {@code failed}, {@code timeout}, {@code skipped} or {@code cancelled}
 */
public record StageSpan(String name, Duration duration, @Nullable Integer itemCount, String outcome) {}
