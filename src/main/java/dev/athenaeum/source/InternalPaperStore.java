package dev.athenaeum.source;

import dev.athenaeum.paper.RawResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Read access to the internal content store of already-ingested papers. */
public interface InternalPaperStore {

  /**
   * Finds papers matching a free-text query.
   *
   * @param query research query
   * @param limit maximum number of papers
   * @param fromYear optional lower bound on publication year; undated papers are excluded when set
   * @return matching papers with {@link dev.athenaeum.paper.PaperSource#INTERNAL} as source, best
   *     match first
   */
  List<RawResult> search(String query, int limit, @Nullable Integer fromYear);
}
