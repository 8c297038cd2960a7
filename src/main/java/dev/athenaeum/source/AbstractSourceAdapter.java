package dev.athenaeum.source;

import dev.athenaeum.cache.CacheKeys;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Template for HTTP-backed adapters. {@link #fetch} runs every call through the same steps:
 *
 * <ol>
 *   <li>result cache lookup (hit returns immediately)
 *   <li>circuit breaker check (open circuit is reported as an error)
 *   <li>retry template, each attempt acquiring a rate-limiter slot before calling {@link
 *       #doSearch}
 *   <li>truncation to the requested limit, then caching of the successful result
 * </ol>
 *
 * <p>Subclasses only build the vendor request and map its payload.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

  private static final Logger log = LoggerFactory.getLogger(AbstractSourceAdapter.class);

  protected final RestClient restClient;
  protected final SourceSupport support;

  protected AbstractSourceAdapter(RestClient restClient, SourceSupport support) {
    this.restClient = restClient;
    this.support = support;
  }

  /**
   * Performs one vendor request and maps the payload.
   *
   * @throws SourceException for HTTP, network and parse failures
   */
  protected abstract List<RawResult> doSearch(String query, SourceQuery options);

  @Override
  public boolean isEnabled() {
    return support.properties().vendor(source()).isEnabled();
  }

  @Override
  public final SourceFetchResult fetch(String query, SourceQuery options) {
    PaperSource source = source();
    long start = System.nanoTime();
    String cacheKey =
        CacheKeys.forSourceQuery(source.tag(), query, options.limit(), options.fromYear());

    Optional<List<RawResult>> cached = support.cache().get(cacheKey);
    if (cached.isPresent()) {
      log.debug("Cache hit for {} ({} results)", source.tag(), cached.get().size());
      return SourceFetchResult.cached(source, cached.get(), elapsedMs(start));
    }

    CircuitBreaker breaker = support.circuitBreaker(source);
    if (!breaker.allowRequest()) {
      log.debug("Circuit open for {}, skipping", source.tag());
      return SourceFetchResult.failure(
          source, "circuit open after repeated failures", elapsedMs(start));
    }

    try {
      List<RawResult> results =
          support
              .retryTemplate(options.fastMode())
              .execute(
                  context -> {
                    awaitRateLimit(source);
                    return doSearch(query, options);
                  });
      if (results.size() > options.limit()) {
        results = results.subList(0, options.limit());
      }
      breaker.recordSuccess();
      support.cache().put(cacheKey, List.copyOf(results), support.cacheTtlFor(results));
      long elapsed = elapsedMs(start);
      log.debug("{} returned {} results in {} ms", source.tag(), results.size(), elapsed);
      return SourceFetchResult.success(source, results, elapsed);
    } catch (SourceException e) {
      if (countsAgainstCircuit(e)) {
        breaker.recordFailure();
      }
      log.warn("{} search failed: {}", source.tag(), e.getMessage());
      return SourceFetchResult.failure(source, e.getMessage(), elapsedMs(start));
    } catch (BackOffInterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("{} search interrupted during retry backoff", source.tag());
      return SourceFetchResult.failure(source, "interrupted", elapsedMs(start));
    }
  }

  /** Only outages trip the breaker; a rejected request says nothing about the source's health. */
  private static boolean countsAgainstCircuit(SourceException e) {
    return e instanceof SourceNetworkException
        || e instanceof TransientSourceException
        || e instanceof SourceRateLimitedException;
  }

  /**
   * Handler for {@code RestClient.ResponseSpec#onStatus} that turns error statuses into the
   * matching {@link SourceHttpException} subtype and defers the rate limiter on 429.
   */
  protected RestClient.ResponseSpec.ErrorHandler statusHandler() {
    return (request, response) -> {
      throw toHttpException(response);
    };
  }

  /**
   * Runs a RestClient exchange, mapping transport failures to {@link SourceNetworkException} and
   * unreadable bodies to {@link SourceParseException}. {@link SourceException}s pass through.
   */
  protected <T> T exchange(RestCall<T> call) {
    try {
      return call.execute();
    } catch (SourceException e) {
      throw e;
    } catch (ResourceAccessException e) {
      throw new SourceNetworkException(
          source(), source().tag() + " unreachable: " + e.getMostSpecificCause().getMessage(), e);
    } catch (RestClientException e) {
      throw new SourceParseException(
          source(), source().tag() + " returned an unreadable body: " + e.getMessage(), e);
    }
  }

  /** A single RestClient call. */
  @FunctionalInterface
  protected interface RestCall<T> {
    T execute();
  }

  private SourceHttpException toHttpException(ClientHttpResponse response)
      throws IOException {
    SourceHttpException exception =
        SourceHttpException.forStatus(
            source(),
            response.getStatusCode().value(),
            response.getHeaders().getFirst("Retry-After"));
    if (exception instanceof SourceRateLimitedException rateLimited) {
      rateLimited.getRetryAfter().ifPresent(support.rateLimiter(source())::deferFor);
    }
    return exception;
  }

  private void awaitRateLimit(PaperSource source) {
    try {
      support.rateLimiter(source).acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceNetworkException(source, source.tag() + " interrupted while throttled", e);
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
