package dev.archivist.access;

import java.util.Set;

/**
 * What a user may read, resolved once per request by an {@link AccessResolver}.
 *
 * <p>Policies are immutable. File names in an {@link AllowedSet} are compared after {@link
 * FilenameNormalizer normalisation}, so grants may be written with any case or directory prefix.
 */
public sealed interface AccessPolicy permits AccessPolicy.Unrestricted, AccessPolicy.AllowedSet {

  static AccessPolicy unrestricted() {
    return new Unrestricted();
  }

  static AccessPolicy allowing(Set<String> fileNames) {
    return new AllowedSet(fileNames);
  }

  /** Every file with a resolvable name is readable. */
  record Unrestricted() implements AccessPolicy {}

  /** Only the listed files are readable; an empty set denies everything. */
  record AllowedSet(Set<String> fileNames) implements AccessPolicy {

    public AllowedSet {
      fileNames = Set.copyOf(fileNames);
    }
  }
}
