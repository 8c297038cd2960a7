package dev.athenaeum.search;

import dev.athenaeum.paper.PaperSource;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for search orchestration.
 *
 * <p>Properties are bound from {@code athenaeum.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-timeout} - global budget when a request gives none (default 15 s)
 *   <li>{@code fast-timeout} - the same in fast mode (default 8 s)
 *   <li>{@code source-allotment} - fraction of the budget a single source may use (default 0.75)
 *   <li>{@code fast-source-allotment} - the same in fast mode (default 0.5)
 *   <li>{@code over-fetch-factor} - per-source limit as a multiple of maxResults (default 2)
 *   <li>{@code max-per-source-limit} - upper bound of the per-source limit (default 50)
 *   <li>{@code fallback-chain} - sources tried in order when too few results arrive
 *   <li>{@code executor-threads} - size of the fan-out thread pool (default 8)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.search")
public class SearchProperties {

  private Duration defaultTimeout = Duration.ofMillis(15_000);
  private Duration fastTimeout = Duration.ofMillis(8_000);
  private double sourceAllotment = 0.75;
  private double fastSourceAllotment = 0.5;
  private int overFetchFactor = 2;
  private int maxPerSourceLimit = 50;
  private List<String> fallbackChain =
      new ArrayList<>(
          List.of("internal", "arxiv", "core", "semantic_scholar", "crossref", "openalex"));
  private int executorThreads = 8;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
      throw new IllegalStateException(
          "athenaeum.search.default-timeout must be positive, got: " + defaultTimeout);
    }
    if (fastTimeout.isNegative() || fastTimeout.isZero()) {
      throw new IllegalStateException(
          "athenaeum.search.fast-timeout must be positive, got: " + fastTimeout);
    }
    if (sourceAllotment <= 0.0 || sourceAllotment > 1.0) {
      throw new IllegalStateException(
          "athenaeum.search.source-allotment must be in (0.0, 1.0], got: " + sourceAllotment);
    }
    if (fastSourceAllotment <= 0.0 || fastSourceAllotment > 1.0) {
      throw new IllegalStateException(
          "athenaeum.search.fast-source-allotment must be in (0.0, 1.0], got: "
              + fastSourceAllotment);
    }
    if (overFetchFactor < 1) {
      throw new IllegalStateException(
          "athenaeum.search.over-fetch-factor must be at least 1, got: " + overFetchFactor);
    }
    if (maxPerSourceLimit < 1) {
      throw new IllegalStateException(
          "athenaeum.search.max-per-source-limit must be at least 1, got: " + maxPerSourceLimit);
    }
    for (String tag : fallbackChain) {
      if (PaperSource.fromTag(tag).isEmpty()) {
        throw new IllegalStateException(
            "athenaeum.search.fallback-chain contains unknown source: " + tag);
      }
    }
    if (executorThreads < 1) {
      throw new IllegalStateException(
          "athenaeum.search.executor-threads must be at least 1, got: " + executorThreads);
    }
  }

  /** Global budget for a request, resolving 0 to the mode's default. */
  public long timeoutMsFor(SearchRequest request) {
    if (request.timeoutMs() > 0) {
      return request.timeoutMs();
    }
    return request.fastMode() ? fastTimeout.toMillis() : defaultTimeout.toMillis();
  }

  /** Portion of the global budget one source may use. */
  public double allotmentFor(SearchRequest request) {
    return request.fastMode() ? fastSourceAllotment : sourceAllotment;
  }

  /** Results requested from each source; halved in fast mode. */
  public int perSourceLimitFor(SearchRequest request) {
    int limit = Math.min(maxPerSourceLimit, request.maxResults() * overFetchFactor);
    if (request.fastMode()) {
      limit = (limit + 1) / 2;
    }
    return Math.max(1, limit);
  }

  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  public void setDefaultTimeout(Duration defaultTimeout) {
    this.defaultTimeout = defaultTimeout;
  }

  public Duration getFastTimeout() {
    return fastTimeout;
  }

  public void setFastTimeout(Duration fastTimeout) {
    this.fastTimeout = fastTimeout;
  }

  public double getSourceAllotment() {
    return sourceAllotment;
  }

  public void setSourceAllotment(double sourceAllotment) {
    this.sourceAllotment = sourceAllotment;
  }

  public double getFastSourceAllotment() {
    return fastSourceAllotment;
  }

  public void setFastSourceAllotment(double fastSourceAllotment) {
    this.fastSourceAllotment = fastSourceAllotment;
  }

  public int getOverFetchFactor() {
    return overFetchFactor;
  }

  public void setOverFetchFactor(int overFetchFactor) {
    this.overFetchFactor = overFetchFactor;
  }

  public int getMaxPerSourceLimit() {
    return maxPerSourceLimit;
  }

  public void setMaxPerSourceLimit(int maxPerSourceLimit) {
    this.maxPerSourceLimit = maxPerSourceLimit;
  }

  public List<String> getFallbackChain() {
    return fallbackChain;
  }

  public void setFallbackChain(List<String> fallbackChain) {
    this.fallbackChain = fallbackChain;
  }

  public int getExecutorThreads() {
    return executorThreads;
  }

  public void setExecutorThreads(int executorThreads) {
    this.executorThreads = executorThreads;
  }
}
