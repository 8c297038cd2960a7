package dev.athenaeum.search;

import dev.athenaeum.paper.RawResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw material gathered by the {@link ParallelSearchOrchestrator}, before ranking.
 *
 * @param results raw results from every source that answered, in source order
 * @param strategiesUsed source tags queried, primary then fallback
 * @param perSourceCounts results contributed per source tag
 * @param errors failed, timed-out and skipped sources
 * @param cacheHits sources answered from cache
 * @param fallbackSourcesUsed tags queried by the fallback chain
 */
public record OrchestrationResult(
    List<RawResult> results,
    List<String> strategiesUsed,
    Map<String, Integer> perSourceCounts,
    List<SourceError> errors,
    int cacheHits,
    List<String> fallbackSourcesUsed) {

  public OrchestrationResult {
    results = List.copyOf(results);
    strategiesUsed = List.copyOf(strategiesUsed);
    perSourceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(perSourceCounts));
    errors = List.copyOf(errors);
    fallbackSourcesUsed = List.copyOf(fallbackSourcesUsed);
  }
}
