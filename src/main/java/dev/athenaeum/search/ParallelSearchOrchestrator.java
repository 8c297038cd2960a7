package dev.athenaeum.search;

import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import dev.athenaeum.source.SourceAdapter;
import dev.athenaeum.source.SourceFetchResult;
import dev.athenaeum.source.SourceQuery;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans a query out to the selected sources in parallel under a global deadline.
 *
 * <p>Every primary source runs as its own task on the search executor. Each task is awaited until
 * {@code min(submitted + allotment, globalDeadline)}; a task still running then is cancelled with
 * interruption (the JDK HTTP client aborts the in-flight exchange) and recorded as a {@code timeout}
 * error, while the results of the other sources are kept.
 *
 * <p>When fewer than {@code minResults} distinct papers arrive and time remains, sources from the
 * configured fallback chain that were not yet tried are queried one at a time, each bounded by the
 * remaining budget, until the minimum is met or the chain is exhausted.
 *
 * <p>Results whose canonical id is in {@link SearchRequest#excludeIds()} are dropped as they
 * arrive, so they neither reach ranking nor count towards {@code minResults}.
 *
 * <p>Partial failure never throws: failing, timed-out and skipped sources end up in {@link
 * OrchestrationResult#errors()}.
 */
@Service
public class ParallelSearchOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ParallelSearchOrchestrator.class);

  private final Map<PaperSource, SourceAdapter> adapters = new EnumMap<>(PaperSource.class);
  private final ExecutorService executor;
  private final SearchProperties properties;

  public ParallelSearchOrchestrator(
      List<SourceAdapter> adapters,
      @Qualifier("searchExecutor") ExecutorService executor,
      SearchProperties properties) {
    for (SourceAdapter adapter : adapters) {
      this.adapters.put(adapter.source(), adapter);
    }
    this.executor = executor;
    this.properties = properties;
  }

  /**
   * Gathers raw results for a request.
   *
   * @param request validated search options
   * @return results and per-source diagnostics, never null
   */
  public OrchestrationResult orchestrate(SearchRequest request) {
    long budgetMs = properties.timeoutMsFor(request);
    long startNanos = System.nanoTime();
    long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(budgetMs);
    long allotmentNanos =
        TimeUnit.MILLISECONDS.toNanos((long) (budgetMs * properties.allotmentFor(request)));
    SourceQuery sourceQuery =
        new SourceQuery(
            properties.perSourceLimitFor(request), request.fromYear(), request.fastMode());

    Accumulator accumulator = new Accumulator(request.excludeIds());
    List<PaperSource> primary = resolvePrimarySources(request);
    log.debug(
        "Searching {} with budget {} ms, per-source limit {}",
        primary,
        budgetMs,
        sourceQuery.limit());

    Map<PaperSource, Future<SourceFetchResult>> futures = new LinkedHashMap<>();
    Map<PaperSource, Long> submittedAt = new EnumMap<>(PaperSource.class);
    for (PaperSource source : primary) {
      SourceAdapter adapter = adapters.get(source);
      try {
        futures.put(source, executor.submit(() -> adapter.fetch(request.query(), sourceQuery)));
        submittedAt.put(source, System.nanoTime());
      } catch (RejectedExecutionException e) {
        accumulator.recordError(source, "rejected: search executor unavailable");
      }
    }

    boolean interrupted = false;
    for (Map.Entry<PaperSource, Future<SourceFetchResult>> entry : futures.entrySet()) {
      PaperSource source = entry.getKey();
      if (interrupted) {
        entry.getValue().cancel(true);
        accumulator.recordError(source, "cancelled");
        continue;
      }
      long waitUntil = Math.min(submittedAt.get(source) + allotmentNanos, deadlineNanos);
      Optional<SourceFetchResult> result =
          await(source, entry.getValue(), waitUntil - System.nanoTime(), accumulator);
      if (result.isEmpty() && Thread.currentThread().isInterrupted()) {
        interrupted = true;
      }
      result.ifPresent(accumulator::record);
    }

    if (!interrupted) {
      runFallbacks(request, sourceQuery, deadlineNanos, primary, accumulator);
    }
    return accumulator.toResult();
  }

  /**
   * Requested tags in order (every source when none are given), unknown tags dropped, filtered by
   * the internal/external toggles and by adapter availability. The internal store is always
   * included, first, when internal search is enabled.
   */
  List<PaperSource> resolvePrimarySources(SearchRequest request) {
    Set<PaperSource> selected = new LinkedHashSet<>();
    if (request.useInternalSearch()) {
      selected.add(PaperSource.INTERNAL);
    }
    if (request.sources().isEmpty()) {
      for (PaperSource source : PaperSource.values()) {
        selected.add(source);
      }
    } else {
      for (String tag : request.sources()) {
        Optional<PaperSource> source = PaperSource.fromTag(tag);
        if (source.isPresent()) {
          selected.add(source.get());
        } else {
          log.debug("Ignoring unknown source tag '{}'", tag);
        }
      }
    }
    List<PaperSource> resolved = new ArrayList<>();
    for (PaperSource source : selected) {
      if (isPermitted(source, request) && isAvailable(source)) {
        resolved.add(source);
      }
    }
    return resolved;
  }

  private void runFallbacks(
      SearchRequest request,
      SourceQuery sourceQuery,
      long deadlineNanos,
      List<PaperSource> tried,
      Accumulator accumulator) {
    if (accumulator.distinctCount() >= request.minResults()) {
      return;
    }
    Set<PaperSource> attempted = new HashSet<>(tried);
    for (String tag : properties.getFallbackChain()) {
      if (accumulator.distinctCount() >= request.minResults()) {
        return;
      }
      Optional<PaperSource> candidate = PaperSource.fromTag(tag);
      if (candidate.isEmpty()) {
        continue;
      }
      PaperSource source = candidate.get();
      if (attempted.contains(source) || !isPermitted(source, request) || !isAvailable(source)) {
        continue;
      }
      long remaining = deadlineNanos - System.nanoTime();
      if (remaining <= 0) {
        log.debug("No time left for fallback sources");
        return;
      }
      attempted.add(source);
      log.debug(
          "Only {} of {} results, trying fallback {}",
          accumulator.distinctCount(),
          request.minResults(),
          source.tag());
      SourceAdapter adapter = adapters.get(source);
      Future<SourceFetchResult> future;
      try {
        future = executor.submit(() -> adapter.fetch(request.query(), sourceQuery));
      } catch (RejectedExecutionException e) {
        accumulator.recordError(source, "rejected: search executor unavailable");
        continue;
      }
      accumulator.markFallback(source);
      Optional<SourceFetchResult> result = await(source, future, remaining, accumulator);
      if (result.isEmpty() && Thread.currentThread().isInterrupted()) {
        return;
      }
      result.ifPresent(accumulator::record);
    }
  }

  /** Waits for one task; on timeout the task is cancelled with interruption. */
  private Optional<SourceFetchResult> await(
      PaperSource source,
      Future<SourceFetchResult> future,
      long waitNanos,
      Accumulator accumulator) {
    try {
      return Optional.of(future.get(Math.max(0L, waitNanos), TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} did not answer in time, cancelled", source.tag());
      accumulator.recordError(source, "timeout");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      accumulator.recordError(source, "cancelled");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("{} task failed: {}", source.tag(), cause.getMessage(), cause);
      accumulator.recordError(source, String.valueOf(cause.getMessage()));
    } catch (CancellationException e) {
      accumulator.recordError(source, "cancelled");
    }
    return Optional.empty();
  }

  private static boolean isPermitted(PaperSource source, SearchRequest request) {
    return source.isExternal() ? request.useExternalApis() : request.useInternalSearch();
  }

  private boolean isAvailable(PaperSource source) {
    SourceAdapter adapter = adapters.get(source);
    return adapter != null && adapter.isEnabled();
  }

  /** Collects per-source outcomes in the order sources were awaited. */
  private static final class Accumulator {

    private final Set<String> excludeIds;
    private final List<RawResult> results = new ArrayList<>();
    private final Set<String> distinctIds = new HashSet<>();
    private final List<String> strategiesUsed = new ArrayList<>();
    private final Map<String, Integer> perSourceCounts = new LinkedHashMap<>();
    private final List<SourceError> errors = new ArrayList<>();
    private final List<String> fallbackSourcesUsed = new ArrayList<>();
    private int cacheHits;

    Accumulator(Set<String> excludeIds) {
      this.excludeIds = excludeIds;
    }

    void record(SourceFetchResult result) {
      String tag = result.source().tag();
      markQueried(tag);
      if (result.cacheHit()) {
        cacheHits++;
      }
      if (!result.isSuccess()) {
        errors.add(new SourceError(tag, result.error()));
      }
      int kept = 0;
      for (RawResult raw : result.results()) {
        if (excludeIds.contains(raw.canonicalId())) {
          continue;
        }
        results.add(raw);
        distinctIds.add(raw.canonicalId());
        kept++;
      }
      if (kept < result.results().size()) {
        log.debug("Excluded {} results from {}", result.results().size() - kept, tag);
      }
      perSourceCounts.put(tag, kept);
    }

    void recordError(PaperSource source, String message) {
      String tag = source.tag();
      markQueried(tag);
      perSourceCounts.putIfAbsent(tag, 0);
      errors.add(new SourceError(tag, message));
    }

    void markFallback(PaperSource source) {
      fallbackSourcesUsed.add(source.tag());
    }

    int distinctCount() {
      return distinctIds.size();
    }

    private void markQueried(String tag) {
      if (!strategiesUsed.contains(tag)) {
        strategiesUsed.add(tag);
      }
    }

    OrchestrationResult toResult() {
      return new OrchestrationResult(
          results, strategiesUsed, perSourceCounts, errors, cacheHits, fallbackSourcesUsed);
    }
  }
}
