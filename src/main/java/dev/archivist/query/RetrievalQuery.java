package dev.archivist.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable query as seen by every retrieval stage.
 *
 * @param rawText the text exactly as the caller sent it
 * @param searchText the text to embed and score, with inline filters removed
 * @param filters inline metadata filters (key to accepted values)
 * @param k number of files requested
 * @param minScore minimum similarity / combined score; 0 disables the threshold
 * @param mode which retrieval branches to run
 */
public record RetrievalQuery(
    String rawText,
    String searchText,
    Map<String, List<String>> filters,
    int k,
    double minScore,
    SearchMode mode) {

  public RetrievalQuery {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    filters.forEach((key, values) -> copy.put(key, List.copyOf(values)));
    filters = Collections.unmodifiableMap(copy);
  }

  /** Builds a query from a parsed string and request parameters. */
  public static RetrievalQuery of(
      String rawText, ParsedQuery parsed, int k, double minScore, SearchMode mode) {
    return new RetrievalQuery(rawText, parsed.searchText(), parsed.filters(), k, minScore, mode);
  }
}
