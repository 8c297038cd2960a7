package dev.athenaeum.region;

import static org.assertj.core.api.Assertions.assertThat;

import dev.athenaeum.fixture.RawResultBuilder;
import dev.athenaeum.paper.CanonicalPaper;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HeuristicRegionDetectorTest {

  private final HeuristicRegionDetector detector = new HeuristicRegionDetector();

  private static CanonicalPaper paper(RawResultBuilder builder) {
    return CanonicalPaper.from(builder.build(), Set.of(), null, 0.5);
  }

  @Test
  void countryCodeDomainIsHighConfidence() {
    Optional<RegionDetection> detection =
        detector.detect(paper(new RawResultBuilder().url("https://www.scielo.br/j/abc")));

    assertThat(detection)
        .contains(new RegionDetection("Brazil", Confidence.HIGH, RegionSignal.URL));
  }

  @Test
  void ukDomainMapsToUnitedKingdom() {
    assertThat(detector.fromUrl("https://www.ox.ac.uk/research/paper")).isEqualTo("United Kingdom");
  }

  @Test
  void genericAndVanityDomainsAreIgnored() {
    assertThat(detector.fromUrl("https://example.org/paper")).isNull();
    assertThat(detector.fromUrl("https://tool.io/paper")).isNull();
    assertThat(detector.fromUrl("not a url at all")).isNull();
    assertThat(detector.fromUrl(null)).isNull();
  }

  @Test
  void venueBeatsTitle() {
    Optional<RegionDetection> detection =
        detector.detect(
            paper(
                new RawResultBuilder()
                    .venue("Journal of the Japan Society")
                    .title("Rainfall patterns in Brazil")));

    assertThat(detection)
        .contains(new RegionDetection("Japan", Confidence.MEDIUM, RegionSignal.VENUE));
  }

  @Test
  void titleIsLowConfidence() {
    Optional<RegionDetection> detection =
        detector.detect(paper(new RawResultBuilder().venue(null).title("Rainfall patterns in Brazil")));

    assertThat(detection)
        .contains(new RegionDetection("Brazil", Confidence.LOW, RegionSignal.TITLE));
  }

  @Test
  void longestCountryNameWins() {
    assertThat(detector.fromText("Malaria in Papua New Guinea")).isEqualTo("Papua New Guinea");
  }

  @Test
  void namesMatchOnWordBoundariesOnly() {
    assertThat(detector.fromText("Japanese Journal of Applied Physics")).isNull();
  }

  @Test
  void usAcronymIsCaseSensitive() {
    assertThat(detector.fromText("Health insurance in the US")).isEqualTo("United States");
    assertThat(detector.fromText("Let us consider the problem")).isNull();
  }

  @Test
  void noSignalYieldsEmpty() {
    assertThat(detector.detect(paper(new RawResultBuilder()))).isEmpty();
  }

  @Test
  void canonicalRegionResolvesAliasesCodesAndNames() {
    assertThat(detector.canonicalRegion("usa")).isEqualTo("United States");
    assertThat(detector.canonicalRegion("BR")).isEqualTo("Brazil");
    assertThat(detector.canonicalRegion(" brazil ")).isEqualTo("Brazil");
    assertThat(detector.canonicalRegion("England")).isEqualTo("United Kingdom");
    assertThat(detector.canonicalRegion("Atlantis ")).isEqualTo("Atlantis");
  }
}
