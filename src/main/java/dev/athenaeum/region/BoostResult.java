package dev.athenaeum.region;

import dev.athenaeum.paper.CanonicalPaper;
import java.util.List;

/**
 * Outcome of a regional boost.
 *
 * @param papers reordered list, same elements as the input
 * @param boosted whether any paper matched the local region
 * @param matchedCount number of papers that matched
 */
public record BoostResult(List<CanonicalPaper> papers, boolean boosted, int matchedCount) {

  public BoostResult {
    papers = List.copyOf(papers);
  }

  static BoostResult unchanged(List<CanonicalPaper> papers) {
    return new BoostResult(papers, false, 0);
  }
}
