package dev.athenaeum.search;

import dev.athenaeum.dedup.DeduplicationEngine;
import dev.athenaeum.paper.CanonicalPaper;
import dev.athenaeum.paper.ScoredResult;
import dev.athenaeum.ranking.HybridRanker;
import dev.athenaeum.region.BoostResult;
import dev.athenaeum.region.RegionDetection;
import dev.athenaeum.region.RegionDetector;
import dev.athenaeum.region.RegionalBooster;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for paper discovery.
 *
 * <p>Pipeline: fan out to sources ({@link ParallelSearchOrchestrator}) -> score and order raw
 * results ({@link HybridRanker}) -> collapse duplicates ({@link DeduplicationEngine}) -> attach
 * detected regions ({@link RegionDetector}) -> move local-region papers forward ({@link
 * RegionalBooster}) -> truncate to {@code maxResults}.
 */
@Service
public class PaperSearchService {

  private static final Logger log = LoggerFactory.getLogger(PaperSearchService.class);

  private final ParallelSearchOrchestrator orchestrator;
  private final HybridRanker ranker;
  private final DeduplicationEngine deduplicationEngine;
  private final RegionDetector regionDetector;
  private final RegionalBooster regionalBooster;

  public PaperSearchService(
      ParallelSearchOrchestrator orchestrator,
      HybridRanker ranker,
      DeduplicationEngine deduplicationEngine,
      RegionDetector regionDetector,
      RegionalBooster regionalBooster) {
    this.orchestrator = orchestrator;
    this.ranker = ranker;
    this.deduplicationEngine = deduplicationEngine;
    this.regionDetector = regionDetector;
    this.regionalBooster = regionalBooster;
  }

  /**
   * Searches every selected source and returns ranked, deduplicated canonical papers.
   *
   * <p>Never throws for source failures; they are reported in {@link SearchMetadata#errors()} and
   * reflected in {@link SearchResponse#status()}.
   *
   * @param request validated search options
   * @return the response, never null
   */
  public SearchResponse search(SearchRequest request) {
    long startNanos = System.nanoTime();

    OrchestrationResult gathered = orchestrator.orchestrate(request);
    List<ScoredResult> ranked = ranker.rank(request.query(), gathered.results(), request.weights());
    List<CanonicalPaper> canonical =
        deduplicationEngine.deduplicate(ranked, request.linkPreprints());
    List<CanonicalPaper> withRegions = attachRegions(canonical);

    String localRegion =
        request.localRegion() == null ? null : regionDetector.canonicalRegion(request.localRegion());
    BoostResult boost = regionalBooster.boost(withRegions, localRegion);

    List<CanonicalPaper> papers = boost.papers();
    int totalFound = papers.size();
    if (papers.size() > request.maxResults()) {
      papers = papers.subList(0, request.maxResults());
    }

    SearchStatus status;
    if (totalFound > 0) {
      status = SearchStatus.FOUND;
    } else if (gathered.errors().isEmpty()) {
      status = SearchStatus.NO_RESULTS;
    } else {
      status = SearchStatus.DEGRADED;
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    SearchMetadata metadata =
        new SearchMetadata(
            gathered.strategiesUsed(),
            gathered.perSourceCounts(),
            gathered.errors(),
            elapsedMs,
            gathered.cacheHits(),
            boost.boosted(),
            boost.matchedCount(),
            totalFound,
            gathered.fallbackSourcesUsed());

    log.info(
        "Search '{}' -> {} papers ({} raw, {} canonical) from {} in {} ms, {} errors",
        request.query(),
        papers.size(),
        gathered.results().size(),
        totalFound,
        gathered.strategiesUsed(),
        elapsedMs,
        gathered.errors().size());
    return new SearchResponse(papers, status, metadata);
  }

  /**
   * Searches for {@code query} with the remaining options taken from {@code options}.
   *
   * @throws InvalidSearchRequestException if {@code query} is blank
   */
  public SearchResponse search(String query, SearchRequest options) {
    return search(options.withQuery(query));
  }

  private List<CanonicalPaper> attachRegions(List<CanonicalPaper> papers) {
    List<CanonicalPaper> withRegions = new ArrayList<>(papers.size());
    for (CanonicalPaper paper : papers) {
      if (paper.region() != null) {
        withRegions.add(paper);
        continue;
      }
      withRegions.add(
          regionDetector.detect(paper).map(RegionDetection::region).map(paper::withRegion)
              .orElse(paper));
    }
    return withRegions;
  }
}
