package dev.athenaeum.region;

import dev.athenaeum.paper.CanonicalPaper;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Moves papers from the user's region to the front of the list. The partition is stable: within
 * the matching and the non-matching group the original order is kept.
 */
@Component
public class RegionalBooster {

  /**
   * Boosts papers whose region equals {@code localRegion}, ignoring case.
   *
   * @param papers ranked papers
   * @param localRegion the user's region; null or blank disables boosting
   * @return the partitioned list with match statistics
   */
  public BoostResult boost(List<CanonicalPaper> papers, @Nullable String localRegion) {
    if (localRegion == null || localRegion.isBlank() || papers.isEmpty()) {
      return BoostResult.unchanged(papers);
    }
    String target = localRegion.trim();
    List<CanonicalPaper> matching = new ArrayList<>();
    List<CanonicalPaper> others = new ArrayList<>();
    for (CanonicalPaper paper : papers) {
      if (paper.region() != null && paper.region().trim().equalsIgnoreCase(target)) {
        matching.add(paper);
      } else {
        others.add(paper);
      }
    }
    if (matching.isEmpty()) {
      return BoostResult.unchanged(papers);
    }
    List<CanonicalPaper> reordered = new ArrayList<>(matching.size() + others.size());
    reordered.addAll(matching);
    reordered.addAll(others);
    return new BoostResult(reordered, true, matching.size());
  }
}
