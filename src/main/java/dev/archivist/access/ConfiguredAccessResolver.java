package dev.archivist.access;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AccessResolver} backed by {@code archivist.access.*} configuration.
 *
 * <p>Admins and users granted {@code *} are unrestricted; other users get their configured file
 * list; unknown users get an empty set.
 */
@Component
public class ConfiguredAccessResolver implements AccessResolver {

  private static final Logger log = LoggerFactory.getLogger(ConfiguredAccessResolver.class);

  static final String WILDCARD = "*";

  private final AccessProperties properties;

  public ConfiguredAccessResolver(AccessProperties properties) {
    this.properties = properties;
  }

  @Override
  public AccessPolicy resolve(String userId) {
    if (properties.admins().contains(userId)) {
      return AccessPolicy.unrestricted();
    }
    List<String> granted = properties.grants().get(userId);
    if (granted == null) {
      log.debug("No grants configured for user {}", userId);
      return AccessPolicy.allowing(Set.of());
    }
    if (granted.contains(WILDCARD)) {
      return AccessPolicy.unrestricted();
    }
    return AccessPolicy.allowing(new LinkedHashSet<>(granted));
  }
}
