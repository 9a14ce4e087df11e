package dev.archivist.access;

import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Canonical form of source file names, shared by access checks and file grouping.
 *
 * <p>Backslashes become {@code /}, the base name is taken, a known temporary-ingestion prefix is
 * stripped and the result is lowercased. So {@code uploads\Temp_Policies.MD} and {@code
 * policies.md} compare equal.
 */
@Component
public class FilenameNormalizer {

  private final List<String> tempPrefixes;

  public FilenameNormalizer(AccessProperties properties) {
    this.tempPrefixes =
        properties.tempPrefixes().stream()
            .filter(p -> !p.isBlank())
            .map(p -> p.toLowerCase(Locale.ROOT))
            .toList();
  }

  /**
   * Normalises a file name for comparison.
   *
   * @param fileName raw name or path, may be null
   * @return the normalised name, or null when nothing usable remains
   */
  public @Nullable String normalize(@Nullable String fileName) {
    String display = displayName(fileName);
    return display == null ? null : display.toLowerCase(Locale.ROOT);
  }

  /**
   * Base name without temporary prefix, original case preserved.
   *
   * @param fileName raw name or path, may be null
   * @return the display name, or null when nothing usable remains
   */
  public @Nullable String displayName(@Nullable String fileName) {
    if (fileName == null) {
      return null;
    }
    String path = fileName.strip().replace('\\', '/');
    String base = path.substring(path.lastIndexOf('/') + 1);
    String lower = base.toLowerCase(Locale.ROOT);
    for (String prefix : tempPrefixes) {
      if (lower.startsWith(prefix) && lower.length() > prefix.length()) {
        base = base.substring(prefix.length());
        break;
      }
    }
    return base.isBlank() ? null : base;
  }
}
