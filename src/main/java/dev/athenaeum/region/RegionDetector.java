package dev.athenaeum.region;

import dev.athenaeum.paper.CanonicalPaper;
import java.util.Optional;

/** Infers the country a paper originates from. */
public interface RegionDetector {

  /**
   * Detects a paper's region.
   *
   * @param paper the deduplicated paper
   * @return the detection, or empty when no signal matched
   */
  Optional<RegionDetection> detect(CanonicalPaper paper);

  /**
   * Maps a user-supplied region (alias, ISO code or name) onto the naming {@link #detect} uses, so
   * that it can be compared with detected regions. Unknown input is returned trimmed.
   */
  default String canonicalRegion(String region) {
    return region.trim();
  }
}
