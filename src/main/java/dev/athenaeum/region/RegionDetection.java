package dev.athenaeum.region;

/**
 * A detected region of origin.
 *
 * @param region English country name, e.g. {@code "Brazil"}
 * @param confidence trust level of the detection
 * @param signal field the region was read from
 */
public record RegionDetection(String region, Confidence confidence, RegionSignal signal) {

  public RegionDetection {
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("region must not be blank");
    }
  }
}
