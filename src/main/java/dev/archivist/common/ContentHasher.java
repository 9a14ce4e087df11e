package dev.archivist.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static utility for SHA-256 hashing. Backs both embedding-cache keys and chunk content hashes used
 * for duplicate removal.
 */
public final class ContentHasher {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Hash of the text after trimming, collapsing whitespace runs and lowercasing, so chunks that
   * differ only in layout or case hash identically.
   */
  public static String normalizedSha256(String text) {
    return sha256(normalize(text));
  }

  static String normalize(String text) {
    return WHITESPACE.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
