package dev.archivist.access;

/** Supplies the access policy of a requesting user. */
public interface AccessResolver {

  /**
   * Resolves the policy for a user. Implementations must fail closed: an unknown user gets an
   * empty {@link AccessPolicy.AllowedSet}, never {@link AccessPolicy.Unrestricted}.
   *
   * @param userId the requesting user
   * @return the user's policy, never null
   */
  AccessPolicy resolve(String userId);
}
