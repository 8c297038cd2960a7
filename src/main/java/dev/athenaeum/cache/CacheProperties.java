package dev.athenaeum.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the source result cache, bound from {@code athenaeum.cache.*}.
 *
 * <ul>
 *   <li>{@code ttl} - lifetime of a non-empty successful lookup (default 5 minutes)
 *   <li>{@code empty-ttl} - lifetime of a successful lookup that found nothing (default 30 s)
 *   <li>{@code max-entries} - capacity before oldest entries are evicted (default 1000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.cache")
public class CacheProperties {

  private Duration ttl = Duration.ofMinutes(5);
  private Duration emptyTtl = Duration.ofSeconds(30);
  private int maxEntries = 1000;

  @PostConstruct
  void validate() {
    if (ttl.isNegative()) {
      throw new IllegalStateException("athenaeum.cache.ttl must not be negative, got: " + ttl);
    }
    if (emptyTtl.isNegative()) {
      throw new IllegalStateException(
          "athenaeum.cache.empty-ttl must not be negative, got: " + emptyTtl);
    }
    if (maxEntries < 1) {
      throw new IllegalStateException(
          "athenaeum.cache.max-entries must be at least 1, got: " + maxEntries);
    }
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public Duration getEmptyTtl() {
    return emptyTtl;
  }

  public void setEmptyTtl(Duration emptyTtl) {
    this.emptyTtl = emptyTtl;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(int maxEntries) {
    this.maxEntries = maxEntries;
  }
}
