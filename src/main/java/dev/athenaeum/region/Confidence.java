package dev.athenaeum.region;

/** How much a region detection can be trusted, by the signal it came from. */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW
}
