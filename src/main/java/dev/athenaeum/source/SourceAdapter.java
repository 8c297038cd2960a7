package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.util.List;

/**
 * A bibliographic backend that can be searched by free-text query.
 *
 * <p>Implementations never throw for ordinary failures (network, HTTP status, malformed body,
 * open circuit); those are reported through {@link SourceFetchResult#error()} and {@link
 * #search} degrades to an empty list.
 */
public interface SourceAdapter {

  PaperSource source();

  /** Whether the adapter is switched on in configuration. Disabled adapters are never queried. */
  default boolean isEnabled() {
    return true;
  }

  /**
   * Queries the source and reports results together with error, cache and timing information.
   *
   * @param query free-text research query
   * @param options result limit, year bound and fast-mode flag
   * @return the call outcome, never null
   */
  SourceFetchResult fetch(String query, SourceQuery options);

  /** Convenience view of {@link #fetch} returning only the results. */
  default List<RawResult> search(String query, SourceQuery options) {
    return fetch(query, options).results();
  }
}
