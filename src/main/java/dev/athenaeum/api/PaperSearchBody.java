package dev.athenaeum.api;

import dev.athenaeum.ranking.RankingWeights;
import dev.athenaeum.search.SearchRequest;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/papers/search}. Every field except {@code query} is optional;
 * absent fields keep the {@link SearchRequest.Builder} defaults.
 */
public record PaperSearchBody(
    @Nullable String query,
    @Nullable Integer maxResults,
    @Nullable Integer minResults,
    @Nullable List<String> sources,
    @Nullable Boolean useInternalSearch,
    @Nullable Boolean useExternalApis,
    @Nullable Boolean fastMode,
    @Nullable Long timeoutMs,
    @Nullable Double semanticWeight,
    @Nullable Double authorityWeight,
    @Nullable Double recencyWeight,
    @Nullable String localRegion,
    @Nullable Boolean linkPreprints,
    @Nullable Integer fromYear,
    @Nullable List<String> excludeIds) {

  /**
   * Converts the body into a validated request.
   *
   * @throws dev.athenaeum.search.InvalidSearchRequestException if any option is out of range
   */
  SearchRequest toSearchRequest() {
    SearchRequest.Builder builder = SearchRequest.builder(query == null ? "" : query);
    if (maxResults != null) {
      builder.maxResults(maxResults);
    }
    if (minResults != null) {
      builder.minResults(minResults);
    }
    if (sources != null) {
      builder.sources(sources);
    }
    if (useInternalSearch != null) {
      builder.useInternalSearch(useInternalSearch);
    }
    if (useExternalApis != null) {
      builder.useExternalApis(useExternalApis);
    }
    if (fastMode != null) {
      builder.fastMode(fastMode);
    }
    if (timeoutMs != null) {
      builder.timeoutMs(timeoutMs);
    }
    if (semanticWeight != null || authorityWeight != null || recencyWeight != null) {
      builder.weights(
          semanticWeight != null ? semanticWeight : RankingWeights.DEFAULT.semantic(),
          authorityWeight != null ? authorityWeight : RankingWeights.DEFAULT.authority(),
          recencyWeight != null ? recencyWeight : RankingWeights.DEFAULT.recency());
    }
    builder.localRegion(localRegion);
    if (linkPreprints != null) {
      builder.linkPreprints(linkPreprints);
    }
    builder.fromYear(fromYear);
    if (excludeIds != null) {
      builder.excludeIds(excludeIds);
    }
    return builder.build();
  }
}
