package dev.archivist.access;

import dev.archivist.search.Candidate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes every candidate the requesting user may not read.
 *
 * <p>Runs on every retrieval, after ranking and before aggregation. A candidate without a
 * resolvable source file is always removed, even under {@link AccessPolicy.Unrestricted}. Each
 * removal is written to the {@code dev.archivist.access.audit} logger.
 */
@Component
public class AccessFilter {

  private static final Logger log = LoggerFactory.getLogger(AccessFilter.class);
  private static final Logger audit = LoggerFactory.getLogger("dev.archivist.access.audit");

  private final FilenameNormalizer normalizer;

  public AccessFilter(FilenameNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  public AccessFilterResult filter(List<Candidate> candidates, AccessPolicy policy, String userId) {
    Set<String> allowedNames = allowedNames(policy);
    List<Candidate> allowed = new ArrayList<>(candidates.size());
    int denied = 0;

    for (Candidate candidate : candidates) {
      String fileName = normalizer.normalize(candidate.sourceFile());
      if (fileName == null) {
        audit.warn(
            "Access denied: user={} chunk={} reason=no source file", userId, candidate.chunkId());
        denied++;
      } else if (allowedNames != null && !allowedNames.contains(fileName)) {
        audit.warn(
            "Access denied: user={} file={} chunk={}", userId, fileName, candidate.chunkId());
        denied++;
      } else {
        allowed.add(candidate);
      }
    }

    if (denied > 0) {
      log.info("Filtered {} of {} candidates for user {}", denied, candidates.size(), userId);
    }
    return new AccessFilterResult(allowed, denied);
  }

  /** Normalised allowed names, or null for an unrestricted policy. */
  private @Nullable Set<String> allowedNames(AccessPolicy policy) {
    if (policy instanceof AccessPolicy.AllowedSet allowedSet) {
      Set<String> names = new HashSet<>();
      for (String name : allowedSet.fileNames()) {
        String normalized = normalizer.normalize(name);
        if (normalized != null) {
          names.add(normalized);
        }
      }
      return names;
    }
    return null;
  }
}
