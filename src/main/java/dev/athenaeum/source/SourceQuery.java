package dev.athenaeum.source;

import org.jspecify.annotations.Nullable;

/**
 * Per-call options passed to a {@link SourceAdapter}.
 *
 * @param limit maximum number of results to request, at least 1
 * @param fromYear optional lower bound on publication year
 * @param fastMode whether the caller is on a shortened time budget
 */
public record SourceQuery(int limit, @Nullable Integer fromYear, boolean fastMode) {

  public SourceQuery {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1, got: " + limit);
    }
  }

  public static SourceQuery of(int limit) {
    return new SourceQuery(limit, null, false);
  }
}
