package dev.athenaeum.cache;

import dev.athenaeum.paper.RawResult;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the shared cache of per-source lookup results. */
@Configuration
public class CacheConfig {

  @Bean
  public ResultCache<List<RawResult>> sourceResultCache(Clock clock, CacheProperties properties) {
    return new TtlResultCache<>(clock, properties.getMaxEntries());
  }
}
