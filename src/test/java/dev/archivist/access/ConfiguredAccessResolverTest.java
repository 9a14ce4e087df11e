package dev.archivist.access;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfiguredAccessResolverTest {

  private final ConfiguredAccessResolver resolver =
      new ConfiguredAccessResolver(
          new AccessProperties(
              List.of("temp_"),
              List.of("root"),
              Map.of(
                  "alice", List.of("policies.md", "handbook.pdf"),
                  "auditor", List.of("*"))));

  @Test
  void adminsAreUnrestricted() {
    assertThat(resolver.resolve("root")).isInstanceOf(AccessPolicy.Unrestricted.class);
  }

  @Test
  void wildcardGrantIsUnrestricted() {
    assertThat(resolver.resolve("auditor")).isInstanceOf(AccessPolicy.Unrestricted.class);
  }

  @Test
  void usersGetTheirConfiguredFiles() {
    assertThat(resolver.resolve("alice"))
        .isEqualTo(AccessPolicy.allowing(Set.of("policies.md", "handbook.pdf")));
  }

  @Test
  void unknownUsersGetAnEmptySet() {
    AccessPolicy policy = resolver.resolve("mallory");

    assertThat(policy).isInstanceOf(AccessPolicy.AllowedSet.class);
    assertThat(((AccessPolicy.AllowedSet) policy).fileNames()).isEmpty();
  }

  @Test
  void missingConfigurationDefaultsToNoGrants() {
    AccessProperties empty = new AccessProperties(null, null, null);

    assertThat(empty.tempPrefixes()).isEmpty();
    assertThat(new ConfiguredAccessResolver(empty).resolve("root"))
        .isInstanceOf(AccessPolicy.AllowedSet.class);
  }
}
