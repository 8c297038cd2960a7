package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one adapter call.
 *
 * @param source the source that was queried
 * @param results results in vendor order, empty on failure
 * @param error human-readable failure reason, null on success
 * @param cacheHit whether the results were served from the result cache
 * @param elapsedMs wall time spent in the call
 */
public record SourceFetchResult(
    PaperSource source,
    List<RawResult> results,
    @Nullable String error,
    boolean cacheHit,
    long elapsedMs) {

  public SourceFetchResult {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static SourceFetchResult success(
      PaperSource source, List<RawResult> results, long elapsedMs) {
    return new SourceFetchResult(source, results, null, false, elapsedMs);
  }

  public static SourceFetchResult cached(
      PaperSource source, List<RawResult> results, long elapsedMs) {
    return new SourceFetchResult(source, results, null, true, elapsedMs);
  }

  public static SourceFetchResult failure(PaperSource source, String error, long elapsedMs) {
    return new SourceFetchResult(source, List.of(), error, false, elapsedMs);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
