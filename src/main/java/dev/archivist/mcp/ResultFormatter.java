package dev.archivist.mcp;

import dev.archivist.retrieval.FileAggregate;
import dev.archivist.search.Candidate;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats file results as text blocks for an agent, within a configurable token budget.
 *
 * <p>Tokens are estimated as characters / 4. Files are appended in rank order until the next one
 * would exceed the budget. If even the first file exceeds it, that file is cut at the character
 * level so that at least one result is always returned.
 */
@Component
public class ResultFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public ResultFormatter(@Value("${archivist.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public String format(@Nullable List<FileAggregate> files) {
    if (files == null || files.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < files.size(); i++) {
      String formatted = formatFile(i + 1, files.get(i));
      int fileTokens = estimateTokens(formatted);

      if (i == 0 && fileTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (estimatedTokens + fileTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += fileTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatFile(int index, FileAggregate file) {
    StringBuilder block =
        new StringBuilder(
            String.format(
                Locale.ROOT,
                "## [%d] File: %s\nScore: %.3f (relevance %.3f)\n\n",
                index,
                file.fileName(),
                file.score(),
                file.relevance()));
    for (Candidate chunk : file.chunks()) {
      block.append(chunk.text()).append("\n\n");
    }
    return block.append("---\n").toString();
  }
}
