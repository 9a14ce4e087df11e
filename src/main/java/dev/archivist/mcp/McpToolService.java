package dev.archivist.mcp;

import dev.archivist.query.SearchMode;
import dev.archivist.retrieval.RetrievalOrchestrator;
import dev.archivist.retrieval.RetrievalRequest;
import dev.archivist.retrieval.RetrievalResponse;
import dev.archivist.retrieval.RetrievalStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing secure retrieval as a tool for AI agents.
 *
 * <p>Tool methods follow the structured error pattern: exceptions are caught and returned as
 * descriptive strings, never thrown.
 *
 * @see ResultFormatter
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int DEFAULT_K = RetrievalRequest.DEFAULT_K;
  static final int MAX_K = 50;

  private final RetrievalOrchestrator orchestrator;
  private final ResultFormatter formatter;

  public McpToolService(RetrievalOrchestrator orchestrator, ResultFormatter formatter) {
    this.orchestrator = orchestrator;
    this.formatter = formatter;
  }

  /** Searches the knowledge base on behalf of a user, returning only files that user may read. */
  @Tool(
      name = "search_knowledge_base",
      description =
          "Search the knowledge base for passages relevant to a query, restricted to files the "
              + "given user may read. Results are grouped by file. The query may contain inline "
              + "filters such as type:pdf or author:\"Jane Doe\".")
  public String searchKnowledgeBase(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Id of the user the search is performed for") @Nullable
          String userId,
      @ToolParam(description = "Maximum number of files (1-50, default 5)", required = false)
          @Nullable Integer k,
      @ToolParam(description = "Search type: vector, keyword or hybrid (default)", required = false)
          @Nullable String searchType,
      @ToolParam(description = "Minimum score (0.0-1.0)", required = false) @Nullable
          Double minScore) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      if (userId == null || userId.isBlank()) {
        return "Error: userId must not be empty.";
      }
      RetrievalRequest request =
          new RetrievalRequest(
              query, userId, clampK(k), SearchMode.parseOrDefault(searchType), minScore);
      RetrievalResponse response = orchestrator.retrieve(request);

      if (response.status() != RetrievalStatus.OK) {
        return response.message();
      }
      String formatted = formatter.format(response.files());
      return response.truncated()
          ? formatted + "\n(More files matched; increase k to see them.)"
          : formatted;
    } catch (Exception e) {
      log.debug("search_knowledge_base rejected: {}", e.getMessage());
      return "Error searching knowledge base: " + e.getMessage();
    }
  }

  static int clampK(@Nullable Integer k) {
    if (k == null) {
      return DEFAULT_K;
    }
    return Math.max(1, Math.min(MAX_K, k));
  }
}
