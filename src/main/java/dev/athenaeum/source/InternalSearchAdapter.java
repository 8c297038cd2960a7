package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adapter over the internal content store. Local lookups are neither cached nor throttled; a
 * failing store is reported as an error like any other source.
 */
@Component
public class InternalSearchAdapter implements SourceAdapter {

  private static final Logger log = LoggerFactory.getLogger(InternalSearchAdapter.class);

  private final InternalPaperStore store;
  private final SourceProperties properties;

  public InternalSearchAdapter(InternalPaperStore store, SourceProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  @Override
  public PaperSource source() {
    return PaperSource.INTERNAL;
  }

  @Override
  public boolean isEnabled() {
    return properties.getInternal().isEnabled();
  }

  @Override
  public SourceFetchResult fetch(String query, SourceQuery options) {
    long start = System.nanoTime();
    try {
      List<RawResult> results = store.search(query, options.limit(), options.fromYear());
      if (results.size() > options.limit()) {
        results = results.subList(0, options.limit());
      }
      return SourceFetchResult.success(PaperSource.INTERNAL, results, elapsedMs(start));
    } catch (RuntimeException e) {
      log.warn("Internal paper store search failed: {}", e.getMessage(), e);
      return SourceFetchResult.failure(
          PaperSource.INTERNAL, "internal store failed: " + e.getMessage(), elapsedMs(start));
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
