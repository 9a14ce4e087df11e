package dev.archivist.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drops candidates whose normalised text was already seen earlier in the ranking.
 *
 * <p>Two chunks are duplicates when their {@link Candidate#contentHash()} values are equal, i.e.
 * their text matches after trimming, whitespace collapsing and lowercasing. The first (best ranked)
 * occurrence wins.
 */
@Component
public class Deduplicator {

  private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

  public List<Candidate> deduplicate(List<Candidate> ranked) {
    Set<String> seen = new HashSet<>();
    List<Candidate> unique = new ArrayList<>(ranked.size());
    for (Candidate candidate : ranked) {
      if (seen.add(candidate.contentHash())) {
        unique.add(candidate);
      }
    }
    if (unique.size() < ranked.size()) {
      log.debug("Removed {} duplicate chunks", ranked.size() - unique.size());
    }
    return unique;
  }
}
