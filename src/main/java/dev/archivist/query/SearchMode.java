package dev.archivist.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Which retrieval branches a query runs. */
public enum SearchMode {
  VECTOR("vector"),
  KEYWORD("keyword"),
  HYBRID("hybrid");

  private final String value;

  SearchMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean usesVector() {
    return this != KEYWORD;
  }

  public boolean usesKeyword() {
    return this != VECTOR;
  }

  @JsonCreator
  public static SearchMode fromValue(String value) {
    for (SearchMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Invalid search type: " + value);
  }

  /**
   * Parses a request parameter, treating null or blank as {@link #HYBRID}. Case-insensitive.
   *
   * @param value the raw parameter (e.g. "vector", "KEYWORD", null)
   * @return the matching mode
   */
  public static SearchMode parseOrDefault(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return HYBRID;
    }
    return fromValue(value.strip());
  }
}
