package dev.athenaeum.source;

import dev.athenaeum.cache.CacheProperties;
import dev.athenaeum.cache.ResultCache;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared per-source call infrastructure: result cache, rate limiters, circuit breakers and retry
 * templates. One rate limiter and one circuit breaker exist per {@link PaperSource}, so every
 * caller of the same source shares its throttling and failure state.
 */
@Component
public class SourceSupport {

  private final ResultCache<List<RawResult>> cache;
  private final CacheProperties cacheProperties;
  private final SourceProperties sourceProperties;
  private final Map<PaperSource, SourceRateLimiter> rateLimiters = new EnumMap<>(PaperSource.class);
  private final Map<PaperSource, CircuitBreaker> circuitBreakers =
      new EnumMap<>(PaperSource.class);
  private final RetryTemplate retryTemplate;
  private final RetryTemplate fastRetryTemplate;

  public SourceSupport(
      ResultCache<List<RawResult>> cache,
      CacheProperties cacheProperties,
      SourceProperties sourceProperties,
      Clock clock) {
    this.cache = cache;
    this.cacheProperties = cacheProperties;
    this.sourceProperties = sourceProperties;
    SourceProperties.Retry retry = sourceProperties.getRetry();
    SourceProperties.Breaker breaker = sourceProperties.getCircuitBreaker();
    for (PaperSource source : PaperSource.values()) {
      rateLimiters.put(
          source,
          new SourceRateLimiter(sourceProperties.vendor(source).getMinInterval(), clock));
      circuitBreakers.put(
          source, new CircuitBreaker(breaker.getFailureThreshold(), breaker.getCooldown(), clock));
    }
    this.retryTemplate =
        buildRetryTemplate(
            retry.getMaxAttempts(),
            retry.getInitialInterval(),
            retry.getMultiplier(),
            retry.getMaxInterval());
    this.fastRetryTemplate =
        buildRetryTemplate(
            retry.getMaxAttempts(),
            retry.getFastInitialInterval(),
            retry.getMultiplier(),
            retry.getFastMaxInterval());
  }

  /**
   * Retries {@link TransientSourceException} and {@link SourceRateLimitedException} with
   * exponential backoff plus random jitter. Every other exception propagates on the first attempt.
   */
  static RetryTemplate buildRetryTemplate(
      int maxAttempts, Duration initialInterval, double multiplier, Duration maxInterval) {
    Map<Class<? extends Throwable>, Boolean> retryable =
        Map.of(TransientSourceException.class, true, SourceRateLimitedException.class, true);
    SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts, retryable, false);

    ExponentialRandomBackOffPolicy backOffPolicy = new ExponentialRandomBackOffPolicy();
    backOffPolicy.setInitialInterval(Math.max(1L, initialInterval.toMillis()));
    backOffPolicy.setMultiplier(multiplier);
    backOffPolicy.setMaxInterval(Math.max(1L, maxInterval.toMillis()));

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(retryPolicy);
    template.setBackOffPolicy(backOffPolicy);
    return template;
  }

  public ResultCache<List<RawResult>> cache() {
    return cache;
  }

  /** TTL for a successful lookup: the short negative window when nothing was found. */
  public Duration cacheTtlFor(List<RawResult> results) {
    return results.isEmpty() ? cacheProperties.getEmptyTtl() : cacheProperties.getTtl();
  }

  public SourceRateLimiter rateLimiter(PaperSource source) {
    return rateLimiters.get(source);
  }

  public CircuitBreaker circuitBreaker(PaperSource source) {
    return circuitBreakers.get(source);
  }

  public RetryTemplate retryTemplate(boolean fastMode) {
    return fastMode ? fastRetryTemplate : retryTemplate;
  }

  public SourceProperties properties() {
    return sourceProperties;
  }
}
