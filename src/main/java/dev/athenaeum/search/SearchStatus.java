package dev.athenaeum.search;

/** Overall outcome of a search. */
public enum SearchStatus {
  /** At least one paper was found, even if {@code maxResults = 0} left none in the response. */
  FOUND,
  /** Every queried source answered and none had a match. */
  NO_RESULTS,
  /** Nothing was found and at least one source failed, so the empty result may be incomplete. */
  DEGRADED
}
