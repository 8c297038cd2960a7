package dev.athenaeum.source;

import dev.athenaeum.paper.PaperNormalizer;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jspecify.annotations.Nullable;

/**
 * {@link InternalPaperStore} held in memory. A paper matches when its title or abstract contains at
 * least one query term; papers are ordered by the number of distinct terms matched, ties keeping
 * insertion order.
 */
public class InMemoryPaperStore implements InternalPaperStore {

  private final List<RawResult> papers = new CopyOnWriteArrayList<>();

  /** Adds a paper. Papers from other sources are re-tagged as internal. */
  public void add(RawResult paper) {
    papers.add(
        paper.source() == PaperSource.INTERNAL
            ? paper
            : new RawResult(
                paper.title(),
                paper.authors(),
                paper.year(),
                paper.abstractText(),
                paper.venue(),
                paper.doi(),
                paper.url(),
                paper.pdfUrl(),
                paper.citationCount(),
                PaperSource.INTERNAL,
                paper.canonicalId()));
  }

  public int size() {
    return papers.size();
  }

  @Override
  public List<RawResult> search(String query, int limit, @Nullable Integer fromYear) {
    Set<String> terms =
        new LinkedHashSet<>(Arrays.asList(PaperNormalizer.normalizeTitle(query).split(" ")));
    terms.remove("");
    if (terms.isEmpty() || limit < 1) {
      return List.of();
    }

    record Match(RawResult paper, long matchedTerms, int position) {}

    List<Match> matches = new ArrayList<>();
    int position = 0;
    for (RawResult paper : papers) {
      position++;
      if (fromYear != null && (paper.year() == null || paper.year() < fromYear)) {
        continue;
      }
      Set<String> words =
          new LinkedHashSet<>(
              Arrays.asList(
                  PaperNormalizer.normalizeTitle(
                          paper.title()
                              + " "
                              + (paper.abstractText() == null ? "" : paper.abstractText()))
                      .split(" ")));
      long matched = terms.stream().filter(words::contains).count();
      if (matched > 0) {
        matches.add(new Match(paper, matched, position));
      }
    }
    return matches.stream()
        .sorted(
            Comparator.comparingLong(Match::matchedTerms)
                .reversed()
                .thenComparingInt(Match::position))
        .limit(limit)
        .map(Match::paper)
        .toList();
  }
}
