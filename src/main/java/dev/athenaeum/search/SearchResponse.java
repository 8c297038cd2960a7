package dev.athenaeum.search;

import dev.athenaeum.paper.CanonicalPaper;
import java.util.List;

/**
 * Result of a paper search.
 *
 * @param papers canonical papers, best first, at most {@code maxResults}
 * @param status overall outcome
 * @param metadata diagnostics
 */
public record SearchResponse(
    List<CanonicalPaper> papers, SearchStatus status, SearchMetadata metadata) {

  public SearchResponse {
    papers = List.copyOf(papers);
  }
}
