package dev.athenaeum.search;

import dev.athenaeum.ranking.RankingWeights;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Options for one paper search.
 *
 * @param query free-text research query (must not be blank)
 * @param maxResults maximum number of canonical papers returned (at least 0; 0 returns no papers
 *     but still reports what was found)
 * @param minResults distinct results below which the fallback chain is consulted (at least 0)
 * @param sources requested source tags in order; empty means every source. Unknown tags are ignored
 * @param useInternalSearch whether the internal content store is queried
 * @param useExternalApis whether external bibliographic APIs are queried
 * @param fastMode shortens the time budget and halves per-source limits
 * @param timeoutMs global deadline in milliseconds; 0 selects the configured default
 * @param semanticWeight weight of embedding similarity
 * @param authorityWeight weight of citation authority
 * @param recencyWeight weight of publication recency
 * @param localRegion region whose papers are moved to the front, null to disable
 * @param linkPreprints whether an arXiv duplicate is recorded as the paper's preprint
 * @param fromYear optional lower bound on publication year, forwarded to every source
 * @param excludeIds canonical ids that must not appear in the results, e.g. papers already cited
 */
public record SearchRequest(
    String query,
    int maxResults,
    int minResults,
    List<String> sources,
    boolean useInternalSearch,
    boolean useExternalApis,
    boolean fastMode,
    long timeoutMs,
    double semanticWeight,
    double authorityWeight,
    double recencyWeight,
    @Nullable String localRegion,
    boolean linkPreprints,
    @Nullable Integer fromYear,
    Set<String> excludeIds) {

  public static final int DEFAULT_MAX_RESULTS = 20;
  public static final int DEFAULT_MIN_RESULTS = 5;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new InvalidSearchRequestException("Query must not be blank");
    }
    if (maxResults < 0) {
      throw new InvalidSearchRequestException("maxResults must not be negative, got: " + maxResults);
    }
    if (minResults < 0) {
      throw new InvalidSearchRequestException("minResults must not be negative, got: " + minResults);
    }
    if (timeoutMs < 0) {
      throw new InvalidSearchRequestException("timeoutMs must not be negative, got: " + timeoutMs);
    }
    try {
      new RankingWeights(semanticWeight, authorityWeight, recencyWeight);
    } catch (IllegalArgumentException e) {
      throw new InvalidSearchRequestException(e.getMessage(), e);
    }
    query = query.trim();
    sources = sources == null ? List.of() : List.copyOf(sources);
    if (localRegion != null && localRegion.isBlank()) {
      localRegion = null;
    }
    excludeIds =
        excludeIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(excludeIds));
  }

  /** Convenience constructor applying every default. */
  public SearchRequest(String query) {
    this(builder(query));
  }

  private SearchRequest(Builder builder) {
    this(
        builder.query,
        builder.maxResults,
        builder.minResults,
        builder.sources,
        builder.useInternalSearch,
        builder.useExternalApis,
        builder.fastMode,
        builder.timeoutMs,
        builder.semanticWeight,
        builder.authorityWeight,
        builder.recencyWeight,
        builder.localRegion,
        builder.linkPreprints,
        builder.fromYear,
        builder.excludeIds);
  }

  public RankingWeights weights() {
    return new RankingWeights(semanticWeight, authorityWeight, recencyWeight);
  }

  /** Same options with a different query. */
  public SearchRequest withQuery(String newQuery) {
    return toBuilder().query(newQuery).build();
  }

  public Builder toBuilder() {
    return builder(query)
        .maxResults(maxResults)
        .minResults(minResults)
        .sources(sources)
        .useInternalSearch(useInternalSearch)
        .useExternalApis(useExternalApis)
        .fastMode(fastMode)
        .timeoutMs(timeoutMs)
        .weights(semanticWeight, authorityWeight, recencyWeight)
        .localRegion(localRegion)
        .linkPreprints(linkPreprints)
        .fromYear(fromYear)
        .excludeIds(excludeIds);
  }

  public static Builder builder(String query) {
    return new Builder(query);
  }

  /** Builder starting from the defaults: 20 results, minimum 5, every source, default weights. */
  public static final class Builder {

    private String query;
    private int maxResults = DEFAULT_MAX_RESULTS;
    private int minResults = DEFAULT_MIN_RESULTS;
    private List<String> sources = new ArrayList<>();
    private boolean useInternalSearch = true;
    private boolean useExternalApis = true;
    private boolean fastMode;
    private long timeoutMs;
    private double semanticWeight = RankingWeights.DEFAULT.semantic();
    private double authorityWeight = RankingWeights.DEFAULT.authority();
    private double recencyWeight = RankingWeights.DEFAULT.recency();
    private @Nullable String localRegion;
    private boolean linkPreprints = true;
    private @Nullable Integer fromYear;
    private Set<String> excludeIds = new LinkedHashSet<>();

    private Builder(String query) {
      this.query = query;
    }

    public Builder query(String query) {
      this.query = query;
      return this;
    }

    public Builder maxResults(int maxResults) {
      this.maxResults = maxResults;
      return this;
    }

    public Builder minResults(int minResults) {
      this.minResults = minResults;
      return this;
    }

    public Builder sources(List<String> sources) {
      this.sources = new ArrayList<>(sources);
      return this;
    }

    public Builder useInternalSearch(boolean useInternalSearch) {
      this.useInternalSearch = useInternalSearch;
      return this;
    }

    public Builder useExternalApis(boolean useExternalApis) {
      this.useExternalApis = useExternalApis;
      return this;
    }

    public Builder fastMode(boolean fastMode) {
      this.fastMode = fastMode;
      return this;
    }

    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    public Builder weights(double semantic, double authority, double recency) {
      this.semanticWeight = semantic;
      this.authorityWeight = authority;
      this.recencyWeight = recency;
      return this;
    }

    public Builder localRegion(@Nullable String localRegion) {
      this.localRegion = localRegion;
      return this;
    }

    public Builder linkPreprints(boolean linkPreprints) {
      this.linkPreprints = linkPreprints;
      return this;
    }

    public Builder fromYear(@Nullable Integer fromYear) {
      this.fromYear = fromYear;
      return this;
    }

    public Builder excludeIds(Collection<String> excludeIds) {
      this.excludeIds = new LinkedHashSet<>();
      for (String id : excludeIds) {
        if (id != null && !id.isBlank()) {
          this.excludeIds.add(id.trim());
        }
      }
      return this;
    }

    /**
     * Validates and builds the request.
     *
     * @throws InvalidSearchRequestException if any option is out of range
     */
    public SearchRequest build() {
      return new SearchRequest(this);
    }
  }
}
