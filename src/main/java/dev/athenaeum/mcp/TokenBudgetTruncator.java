package dev.athenaeum.mcp;

import dev.athenaeum.paper.Author;
import dev.athenaeum.paper.CanonicalPaper;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats canonical papers as text blocks and keeps as many as fit a token budget.
 *
 * <p>Tokens are estimated as characters / 4. If the first paper alone exceeds the budget it is cut
 * at the character level, so at least one paper is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final int MAX_LISTED_AUTHORS = 5;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${athenaeum.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats papers in order until the budget is reached.
   *
   * @param papers ranked papers
   * @return formatted listing, empty for no papers
   */
  public String truncate(@Nullable List<CanonicalPaper> papers) {
    if (papers == null || papers.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < papers.size(); i++) {
      String formatted = formatPaper(i + 1, papers.get(i));
      int paperTokens = estimateTokens(formatted);

      if (i == 0 && paperTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + paperTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += paperTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatPaper(int index, CanonicalPaper paper) {
    StringBuilder block = new StringBuilder();
    block.append("## [").append(index).append("] ").append(paper.title());
    if (paper.year() != null) {
      block.append(" (").append(paper.year()).append(')');
    }
    block.append('\n');
    block.append("Authors: ").append(formatAuthors(paper.authors())).append('\n');
    appendLine(block, "Venue", paper.venue());
    appendLine(block, "DOI", paper.doi());
    appendLine(block, "URL", paper.url());
    appendLine(block, "PDF", paper.pdfUrl());
    appendLine(block, "Preprint", paper.preprintId());
    appendLine(block, "Region", paper.region());
    block.append(
        String.format(
            Locale.ROOT,
            "Source: %s | Citations: %d | Score: %.3f\n",
            paper.source().tag(),
            paper.citationCount() == null ? 0 : paper.citationCount(),
            paper.combinedScore()));
    if (paper.abstractText() != null) {
      block.append('\n').append(paper.abstractText()).append('\n');
    }
    block.append("\n---\n");
    return block.toString();
  }

  private static void appendLine(StringBuilder block, String label, @Nullable String value) {
    if (value != null) {
      block.append(label).append(": ").append(value).append('\n');
    }
  }

  private static String formatAuthors(List<Author> authors) {
    if (authors.isEmpty()) {
      return "unknown";
    }
    String listed =
        authors.stream()
            .limit(MAX_LISTED_AUTHORS)
            .map(Author::name)
            .collect(Collectors.joining(", "));
    return authors.size() > MAX_LISTED_AUTHORS ? listed + ", et al." : listed;
  }
}
