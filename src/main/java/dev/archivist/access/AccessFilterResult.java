package dev.archivist.access;

import dev.archivist.search.Candidate;
import java.util.List;

/**
 * Outcome of access filtering.
 *
 * @param allowed candidates the user may read, in input order
 * @param deniedCount number of candidates removed; for telemetry only
 */
public record AccessFilterResult(List<Candidate> allowed, int deniedCount) {

  public AccessFilterResult {
    allowed = List.copyOf(allowed);
  }
}
