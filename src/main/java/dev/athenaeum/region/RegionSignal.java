package dev.athenaeum.region;

/** Paper field a region was detected from. */
public enum RegionSignal {
  URL,
  VENUE,
  TITLE
}
