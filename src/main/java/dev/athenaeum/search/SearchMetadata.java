package dev.athenaeum.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics attached to every {@link SearchResponse}.
 *
 * @param strategiesUsed source tags actually queried, primary sources first, then fallbacks
 * @param perSourceCounts number of raw results each queried source contributed
 * @param errors failed, timed-out and skipped sources
 * @param elapsedMs wall time of the whole search
 * @param cacheHits number of sources answered from the result cache
 * @param localRegionBoost whether any paper was moved forward for the local region
 * @param localPapersCount number of papers matching the local region
 * @param totalFound canonical papers found before truncation to {@code maxResults}
 * @param fallbackSourcesUsed sources queried by the fallback chain
 */
public record SearchMetadata(
    List<String> strategiesUsed,
    Map<String, Integer> perSourceCounts,
    List<SourceError> errors,
    long elapsedMs,
    int cacheHits,
    boolean localRegionBoost,
    int localPapersCount,
    int totalFound,
    List<String> fallbackSourcesUsed) {

  public SearchMetadata {
    strategiesUsed = List.copyOf(strategiesUsed);
    perSourceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(perSourceCounts));
    errors = List.copyOf(errors);
    fallbackSourcesUsed = List.copyOf(fallbackSourcesUsed);
  }
}
