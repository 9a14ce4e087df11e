package dev.archivist.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link QueryParser}: the text left for searching plus inline filters.
 *
 * @param searchText query text with filter tokens removed and whitespace collapsed
 * @param filters filter key to its values, in first-seen order, without duplicates
 */
public record ParsedQuery(String searchText, Map<String, List<String>> filters) {

  public ParsedQuery {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    filters.forEach((key, values) -> copy.put(key, List.copyOf(values)));
    filters = Collections.unmodifiableMap(copy);
  }

  public boolean hasFilters() {
    return !filters.isEmpty();
  }
}
