package dev.athenaeum.dedup;

import dev.athenaeum.paper.CanonicalPaper;
import dev.athenaeum.paper.PaperNormalizer;
import dev.athenaeum.paper.RawResult;
import dev.athenaeum.paper.ScoredResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Collapses results describing the same work into {@link CanonicalPaper}s.
 *
 * <p>Two results belong to the same cluster when they share a normalised DOI or a normalised title;
 * membership is transitive (A shares a DOI with B, B shares a title with C: all three merge).
 * Clusters are emitted in the order of their first member in the input, so a ranked input stays
 * ranked.
 *
 * <p>Representative selection, first rule that applies:
 *
 * <ol>
 *   <li>arXiv member plus a DOI-bearing non-arXiv member: the highest-cited journal member wins and
 *       the arXiv member becomes the linked preprint
 *   <li>exactly one member has a DOI: it wins
 *   <li>highest citation count among DOI-bearing members, or among all members when none has a
 *       DOI; ties keep the earlier member
 * </ol>
 */
@Component
public class DeduplicationEngine {

  /**
   * Deduplicates ranked results.
   *
   * @param results ranked results, best first
   * @param linkPreprints whether to record the arXiv version as {@code preprintId}; clustering and
   *     representative choice are the same either way
   * @return canonical papers in first-member order
   */
  public List<CanonicalPaper> deduplicate(List<ScoredResult> results, boolean linkPreprints) {
    List<CanonicalPaper> papers = new ArrayList<>();
    for (List<ScoredResult> cluster : cluster(results)) {
      Selection selection = selectRepresentative(cluster);
      String preprintId =
          linkPreprints && selection.preprint() != null ? preprintId(selection.preprint()) : null;
      papers.add(toCanonical(cluster, selection.representative(), preprintId));
    }
    return papers;
  }

  /**
   * Cheap order-preserving variant: same clustering, the first member of each cluster is the
   * representative and no preprint is linked.
   */
  public List<CanonicalPaper> simpleDeduplicate(List<ScoredResult> results) {
    List<CanonicalPaper> papers = new ArrayList<>();
    for (List<ScoredResult> cluster : cluster(results)) {
      papers.add(toCanonical(cluster, cluster.get(0), null));
    }
    return papers;
  }

  /** Groups results by shared DOI or title key, clusters and members in encounter order. */
  static List<List<ScoredResult>> cluster(List<ScoredResult> results) {
    int n = results.size();
    int[] parent = new int[n];
    for (int i = 0; i < n; i++) {
      parent[i] = i;
    }
    Map<String, Integer> firstByKey = new HashMap<>();
    for (int i = 0; i < n; i++) {
      RawResult raw = results.get(i).raw();
      String doi = PaperNormalizer.normalizeDoi(raw.doi());
      if (doi != null) {
        unionByKey(parent, firstByKey, "doi:" + doi, i);
      }
      String title = PaperNormalizer.normalizeTitle(raw.title());
      if (!title.isEmpty()) {
        unionByKey(parent, firstByKey, "title:" + title, i);
      }
    }

    Map<Integer, List<ScoredResult>> clusters = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      clusters.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(results.get(i));
    }
    return new ArrayList<>(clusters.values());
  }

  private static void unionByKey(int[] parent, Map<String, Integer> firstByKey, String key, int i) {
    Integer first = firstByKey.putIfAbsent(key, i);
    if (first != null) {
      union(parent, first, i);
    }
  }

  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }

  /** Roots always point at the lower index, so a cluster's root is its first member. */
  private static void union(int[] parent, int a, int b) {
    int rootA = find(parent, a);
    int rootB = find(parent, b);
    if (rootA == rootB) {
      return;
    }
    if (rootA < rootB) {
      parent[rootB] = rootA;
    } else {
      parent[rootA] = rootB;
    }
  }

  record Selection(ScoredResult representative, @Nullable ScoredResult preprint) {}

  static Selection selectRepresentative(List<ScoredResult> cluster) {
    if (cluster.size() == 1) {
      return new Selection(cluster.get(0), null);
    }

    ScoredResult preprint = null;
    List<ScoredResult> journals = new ArrayList<>();
    List<ScoredResult> withDoi = new ArrayList<>();
    for (ScoredResult member : cluster) {
      RawResult raw = member.raw();
      if (raw.isArxiv()) {
        if (preprint == null) {
          preprint = member;
        }
      } else if (raw.hasDoi()) {
        journals.add(member);
      }
      if (raw.hasDoi()) {
        withDoi.add(member);
      }
    }

    if (preprint != null && !journals.isEmpty()) {
      return new Selection(mostCited(journals), preprint);
    }
    if (withDoi.size() == 1) {
      return new Selection(withDoi.get(0), null);
    }
    return new Selection(mostCited(withDoi.isEmpty() ? cluster : withDoi), null);
  }

  private static ScoredResult mostCited(List<ScoredResult> candidates) {
    ScoredResult best = candidates.get(0);
    for (ScoredResult candidate : candidates) {
      if (candidate.raw().citationsOrZero() > best.raw().citationsOrZero()) {
        best = candidate;
      }
    }
    return best;
  }

  /** The arXiv landing page, or the arXiv record's canonical id when it has no URL. */
  private static String preprintId(ScoredResult preprint) {
    String url = preprint.raw().url();
    return url != null ? url : preprint.canonicalId();
  }

  private static CanonicalPaper toCanonical(
      List<ScoredResult> cluster, ScoredResult representative, @Nullable String preprintId) {
    Set<String> siblings = new LinkedHashSet<>();
    double bestScore = representative.combinedScore();
    for (ScoredResult member : cluster) {
      if (member != representative) {
        siblings.add(member.canonicalId());
      }
      bestScore = Math.max(bestScore, member.combinedScore());
    }
    return CanonicalPaper.from(representative.raw(), siblings, preprintId, bestScore);
  }
}
