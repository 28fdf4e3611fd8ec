package dev.scriptorium.mcp;

import dev.scriptorium.search.SearchResult;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Truncates search results to fit within a configurable token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). Results are formatted as readable text
 * blocks with their source reference and scores, then accumulated until the token budget is
 * reached.
 *
 * <p>If even the first result exceeds the budget, it is included but truncated at the character
 * level so that at least one result is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${scriptorium.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates search results to fit within the configured token budget.
   *
   * @param results the search results to format and truncate
   * @return formatted text containing as many results as fit within the token budget
   */
  public String truncate(@Nullable List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < results.size(); i++) {
      String formatted = formatResult(i + 1, results.get(i));
      int resultTokens = estimateTokens(formatted);

      if (i == 0 && resultTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + resultTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += resultTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatResult(int index, SearchResult result) {
    String scores =
        result.isReranked()
            ? String.format(
                Locale.ROOT, "Score: %.3f | Rerank: %.3f", result.score(), result.rerankScore())
            : String.format(Locale.ROOT, "Score: %.3f", result.score());
    return "## [%d] Source: %s\n%s\n\n%s\n\n---\n"
        .formatted(index, result.sourceReference(), scores, result.content());
  }
}
