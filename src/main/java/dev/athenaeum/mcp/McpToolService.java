package dev.athenaeum.mcp;

import dev.athenaeum.search.PaperSearchService;
import dev.athenaeum.search.SearchMetadata;
import dev.athenaeum.search.SearchRequest;
import dev.athenaeum.search.SearchResponse;
import dev.athenaeum.search.SearchStatus;
import dev.athenaeum.search.SourceError;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing paper discovery as a tool.
 *
 * <p>Tool methods never throw: failures are returned as descriptive error strings.
 *
 * @see TokenBudgetTruncator
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_RESULTS_CAP = 50;

  private final PaperSearchService searchService;
  private final TokenBudgetTruncator truncator;

  public McpToolService(PaperSearchService searchService, TokenBudgetTruncator truncator) {
    this.searchService = searchService;
    this.truncator = truncator;
  }

  /** Searches academic sources and returns a ranked, deduplicated listing within the budget. */
  @Tool(
      name = "search_papers",
      description =
          "Search academic papers across OpenAlex, Crossref, Semantic Scholar, arXiv, CORE and the "
              + "internal library. Returns deduplicated papers ranked by relevance, citations and "
              + "recency, with DOIs, links and abstracts for citation.")
  public String searchPapers(
      @ToolParam(description = "Research query text") @Nullable String query,
      @ToolParam(description = "Maximum number of papers (1-50, default 20)", required = false)
          @Nullable Integer maxResults,
      @ToolParam(
              description =
                  "Comma-separated sources: openalex, crossref, semantic_scholar, arxiv, core, "
                      + "internal. Empty means all.",
              required = false)
          @Nullable String sources,
      @ToolParam(description = "Only papers published in or after this year", required = false)
          @Nullable Integer fromYear,
      @ToolParam(
              description = "Country whose papers should be listed first, e.g. 'Brazil' or 'BR'",
              required = false)
          @Nullable String localRegion,
      @ToolParam(description = "Shorter time budget and smaller per-source limits", required = false)
          @Nullable Boolean fastMode,
      @ToolParam(
              description =
                  "Comma-separated canonical ids of papers to leave out, e.g. ones already cited",
              required = false)
          @Nullable String excludeIds) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a research query string.";
      }
      SearchRequest.Builder builder =
          SearchRequest.builder(query)
              .maxResults(clampMaxResults(maxResults))
              .sources(parseCommaSeparated(sources))
              .fromYear(fromYear)
              .localRegion(localRegion)
              .excludeIds(parseCommaSeparated(excludeIds));
      if (fastMode != null) {
        builder.fastMode(fastMode);
      }
      SearchResponse response = searchService.search(builder.build());

      if (response.papers().isEmpty()) {
        return buildEmptyResultMessage(query, response);
      }
      return truncator.truncate(response.papers()) + buildFooter(response.metadata());
    } catch (Exception e) {
      log.warn("search_papers failed for '{}': {}", query, e.getMessage());
      return "Error searching papers: " + e.getMessage();
    }
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return SearchRequest.DEFAULT_MAX_RESULTS;
    }
    return Math.min(maxResults, MAX_RESULTS_CAP);
  }

  private String buildEmptyResultMessage(String query, SearchResponse response) {
    if (response.status() == SearchStatus.DEGRADED) {
      return "No papers found for query '%s'. Some sources failed: %s"
          .formatted(query, formatErrors(response.metadata().errors()));
    }
    return "No papers found for query: " + query;
  }

  private String buildFooter(SearchMetadata metadata) {
    String footer =
        "Found %d papers from %s in %d ms."
            .formatted(
                metadata.totalFound(),
                String.join(", ", metadata.strategiesUsed()),
                metadata.elapsedMs());
    if (!metadata.errors().isEmpty()) {
      footer += " Unavailable: " + formatErrors(metadata.errors()) + ".";
    }
    return footer;
  }

  private static String formatErrors(List<SourceError> errors) {
    return errors.stream()
        .map(error -> error.source() + " (" + error.message() + ")")
        .collect(Collectors.joining(", "));
  }

  private static List<String> parseCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
