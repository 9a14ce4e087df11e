package dev.archivist.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.common.StageOutcome;
import dev.archivist.document.DocumentChunkRepository;
import dev.archivist.query.RetrievalQuery;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lexical retrieval branch: loads a window of chunks sharing at least one term with the query and
 * ranks them with BM25.
 *
 * <p>Per document {@code d} and distinct query term {@code t}:
 *
 * <pre>
 * score(d) = sum IDF(t) * f(t,d) * (k1 + 1) / (f(t,d) + k1 * (1 - b + b * |d| / avgdl))
 * IDF(t)   = ln(1 + (N - n(t) + 0.5) / (n(t) + 0.5))
 * </pre>
 *
 * <p>{@code N}, {@code n(t)} and {@code avgdl} are computed over the candidate window only, not the
 * whole corpus. Raw scores are divided by the window maximum so keyword scores share the 0-1 range
 * of vector similarities. A document with no query term scores 0.
 */
@Service
public class KeywordScorer {

  private static final Logger log = LoggerFactory.getLogger(KeywordScorer.class);

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final DocumentChunkRepository documentChunkRepository;
  private final ObjectMapper objectMapper;
  private final SearchProperties properties;

  public KeywordScorer(
      DocumentChunkRepository documentChunkRepository,
      ObjectMapper objectMapper,
      SearchProperties properties) {
    this.documentChunkRepository = documentChunkRepository;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Runs the keyword branch for a query.
   *
   * @param query the parsed query
   * @return candidates ordered by keyword score descending (window order on ties), or the store
   *     failure
   */
  public StageOutcome<List<Candidate>> search(RetrievalQuery query) {
    List<String> terms = tokenize(query.searchText());
    if (terms.isEmpty()) {
      return StageOutcome.success(List.of());
    }

    List<Object[]> rows;
    try {
      rows =
          documentChunkRepository.findKeywordCandidates(
              String.join(" | ", terms), properties.getKeywordFetchSize());
    } catch (RuntimeException e) {
      return StageOutcome.failure(
          new StoreUnavailableException("Keyword candidate query failed: " + e.getMessage(), e));
    }

    List<Candidate> window = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Candidate candidate = toCandidate(row);
      if (matchesFilters(candidate, query.filters())) {
        window.add(candidate);
      }
    }

    List<Candidate> ranked = rank(terms, window);
    log.debug("Keyword search scored {} candidates for {} terms", ranked.size(), terms.size());
    return StageOutcome.success(ranked);
  }

  /**
   * Scores a window with BM25 and normalises by the best raw score.
   *
   * @param queryTerms distinct query terms
   * @param window candidates forming the scoring window
   * @return the same candidates with keyword scores set, best first
   */
  List<Candidate> rank(List<String> queryTerms, List<Candidate> window) {
    if (window.isEmpty()) {
      return List.of();
    }
    double k1 = properties.getBm25K1();
    double b = properties.getBm25B();

    List<Map<String, Integer>> termFrequencies = new ArrayList<>(window.size());
    int[] lengths = new int[window.size()];
    Map<String, Integer> documentFrequency = new HashMap<>();
    long totalLength = 0;

    for (int i = 0; i < window.size(); i++) {
      Map<String, Integer> frequencies = new HashMap<>();
      List<String> tokens = tokenizeAll(window.get(i).text());
      for (String token : tokens) {
        frequencies.merge(token, 1, Integer::sum);
      }
      termFrequencies.add(frequencies);
      lengths[i] = tokens.size();
      totalLength += tokens.size();
      for (String term : queryTerms) {
        if (frequencies.containsKey(term)) {
          documentFrequency.merge(term, 1, Integer::sum);
        }
      }
    }

    int n = window.size();
    double avgdl = Math.max(1.0, (double) totalLength / n);
    double[] raw = new double[n];
    double max = 0.0;

    for (int i = 0; i < n; i++) {
      double score = 0.0;
      for (String term : queryTerms) {
        int tf = termFrequencies.get(i).getOrDefault(term, 0);
        if (tf == 0) {
          continue;
        }
        int df = documentFrequency.getOrDefault(term, 0);
        double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
        double norm = k1 * (1.0 - b + b * lengths[i] / avgdl);
        score += idf * tf * (k1 + 1.0) / (tf + norm);
      }
      raw[i] = score;
      max = Math.max(max, score);
    }

    List<Candidate> ranked = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      ranked.add(window.get(i).withKeywordScore(max > 0.0 ? raw[i] / max : 0.0));
    }
    // List.sort is stable, so window order breaks ties
    ranked.sort((x, y) -> Double.compare(y.keywordScore(), x.keywordScore()));
    return ranked;
  }

  /** Lowercased, distinct terms of a query in first-seen order. */
  static List<String> tokenize(String text) {
    return new ArrayList<>(new LinkedHashSet<>(tokenizeAll(text)));
  }

  /** Lowercased tokens split on any character that is not a letter or digit. */
  static List<String> tokenizeAll(String text) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetterOrDigit(c)) {
        current.append(c);
      } else if (!current.isEmpty()) {
        tokens.add(current.toString().toLowerCase(Locale.ROOT));
        current.setLength(0);
      }
    }
    if (!current.isEmpty()) {
      tokens.add(current.toString().toLowerCase(Locale.ROOT));
    }
    return tokens;
  }

  private Candidate toCandidate(Object[] row) {
    String id = String.valueOf(row[0]);
    String text = row[1] == null ? "" : row[1].toString();
    return new Candidate(id, text, parseMetadata(id, row.length > 2 ? row[2] : null));
  }

  private Map<String, Object> parseMetadata(String chunkId, @Nullable Object raw) {
    if (raw == null) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(raw.toString(), METADATA_TYPE);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException e) {
      log.warn("Chunk {} has unparseable metadata, treating as empty: {}", chunkId, e.getMessage());
      return Map.of();
    }
  }

  private static boolean matchesFilters(Candidate candidate, Map<String, List<String>> filters) {
    for (Map.Entry<String, List<String>> filter : filters.entrySet()) {
      Object value = candidate.metadata().get(filter.getKey());
      Set<String> accepted = new LinkedHashSet<>(filter.getValue());
      if (value == null || !accepted.contains(Objects.toString(value))) {
        return false;
      }
    }
    return true;
  }
}
