package dev.archivist.access;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Access control settings bound from {@code archivist.access.*}.
 *
 * @param tempPrefixes file name prefixes added by the ingestion pipeline to temporary uploads,
 *     stripped before comparison
 * @param admins users with unrestricted access
 * @param grants readable file names per user; a {@code *} entry grants everything
 */
@ConfigurationProperties(prefix = "archivist.access")
public record AccessProperties(
    @DefaultValue("temp_") List<String> tempPrefixes,
    List<String> admins,
    Map<String, List<String>> grants) {

  public AccessProperties {
    tempPrefixes = tempPrefixes == null ? List.of() : List.copyOf(tempPrefixes);
    admins = admins == null ? List.of() : List.copyOf(admins);
    grants = grants == null ? Map.of() : Map.copyOf(grants);
  }
}
