package dev.archivist.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Tokenizer for inline query filters.
 *
 * <p>Recognised forms, each a single whitespace-delimited token:
 *
 * <ul>
 *   <li>{@code key:value}
 *   <li>{@code key:"quoted value"} (the quoted part may contain spaces)
 *   <li>{@code is:type}, stored under the key {@code type}
 * </ul>
 *
 * <p>Filter tokens are removed from the search text; repeated keys collect their values in order.
 * Parsing never fails: an unterminated quote, an empty value or a URL-like {@code scheme://} token
 * is kept in the search text verbatim. If nothing but filters remains, the raw query is searched.
 */
@Component
public class QueryParser {

  static final String TYPE_KEY = "type";
  private static final String IS_KEY = "is";

  /**
   * Parses a raw query string.
   *
   * @param raw the query as typed by the user
   * @return search text and the extracted filters
   */
  public ParsedQuery parse(String raw) {
    List<String> words = new ArrayList<>();
    Map<String, Set<String>> filters = new LinkedHashMap<>();
    int length = raw.length();
    int pos = 0;

    while (pos < length) {
      if (Character.isWhitespace(raw.charAt(pos))) {
        pos++;
        continue;
      }
      int keyEnd = pos;
      while (keyEnd < length && isKeyChar(raw.charAt(keyEnd))) {
        keyEnd++;
      }
      if (keyEnd > pos && keyEnd + 1 < length && raw.charAt(keyEnd) == ':') {
        String key = raw.substring(pos, keyEnd);
        int valueStart = keyEnd + 1;
        char first = raw.charAt(valueStart);

        if (first == '"') {
          int close = raw.indexOf('"', valueStart + 1);
          String value = close < 0 ? "" : raw.substring(valueStart + 1, close).strip();
          if (!value.isEmpty()) {
            addFilter(filters, key, value);
            pos = close + 1;
            continue;
          }
        } else if (!Character.isWhitespace(first) && !raw.startsWith("//", valueStart)) {
          int valueEnd = wordEnd(raw, valueStart);
          addFilter(filters, key, raw.substring(valueStart, valueEnd));
          pos = valueEnd;
          continue;
        }
      }
      int end = wordEnd(raw, pos);
      words.add(raw.substring(pos, end));
      pos = end;
    }

    String searchText = String.join(" ", words);
    if (searchText.isEmpty()) {
      searchText = String.join(" ", raw.strip().split("\\s+"));
    }

    Map<String, List<String>> result = new LinkedHashMap<>();
    filters.forEach((key, values) -> result.put(key, List.copyOf(values)));
    return new ParsedQuery(searchText, result);
  }

  private static void addFilter(Map<String, Set<String>> filters, String key, String value) {
    String normalizedKey = IS_KEY.equals(key) ? TYPE_KEY : key;
    filters.computeIfAbsent(normalizedKey, k -> new LinkedHashSet<>()).add(value);
  }

  private static int wordEnd(String raw, int from) {
    int end = from;
    while (end < raw.length() && !Character.isWhitespace(raw.charAt(end))) {
      end++;
    }
    return end;
  }

  private static boolean isKeyChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
  }
}
