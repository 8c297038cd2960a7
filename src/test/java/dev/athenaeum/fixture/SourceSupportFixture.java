package dev.athenaeum.fixture;

import dev.athenaeum.cache.CacheProperties;
import dev.athenaeum.cache.TtlResultCache;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.source.SourceProperties;
import dev.athenaeum.source.SourceSupport;
import java.time.Clock;
import java.time.Duration;

/** {@link SourceSupport} wired for unit tests: no throttling and millisecond retry backoff. */
public final class SourceSupportFixture {

  private SourceSupportFixture() {}

  public static SourceProperties fastProperties() {
    SourceProperties properties = new SourceProperties();
    for (PaperSource source : PaperSource.values()) {
      properties.vendor(source).setMinInterval(Duration.ZERO);
    }
    properties.getRetry().setInitialInterval(Duration.ofMillis(1));
    properties.getRetry().setMaxInterval(Duration.ofMillis(2));
    properties.getRetry().setFastInitialInterval(Duration.ofMillis(1));
    properties.getRetry().setFastMaxInterval(Duration.ofMillis(2));
    return properties;
  }

  public static SourceSupport support() {
    return support(fastProperties(), Clock.systemUTC());
  }

  public static SourceSupport support(SourceProperties properties, Clock clock) {
    CacheProperties cacheProperties = new CacheProperties();
    return new SourceSupport(
        new TtlResultCache<>(clock, cacheProperties.getMaxEntries()),
        cacheProperties,
        properties,
        clock);
  }
}
