package dev.athenaeum.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  private final SearchProperties properties = new SearchProperties();

  @Test
  void defaultsAreValid() {
    assertThatCode(properties::validate).doesNotThrowAnyException();
  }

  @Test
  void requestTimeoutWinsOverDefaults() {
    assertThat(properties.timeoutMsFor(SearchRequest.builder("q").timeoutMs(1234).build()))
        .isEqualTo(1234);
    assertThat(properties.timeoutMsFor(new SearchRequest("q"))).isEqualTo(15_000);
    assertThat(properties.timeoutMsFor(SearchRequest.builder("q").fastMode(true).build()))
        .isEqualTo(8_000);
  }

  @Test
  void perSourceLimitOverFetchesUpToTheCap() {
    assertThat(properties.perSourceLimitFor(SearchRequest.builder("q").maxResults(10).build()))
        .isEqualTo(20);
    assertThat(properties.perSourceLimitFor(SearchRequest.builder("q").maxResults(40).build()))
        .isEqualTo(50);
  }

  @Test
  void fastModeHalvesThePerSourceLimit() {
    SearchRequest request = SearchRequest.builder("q").maxResults(10).fastMode(true).build();

    assertThat(properties.perSourceLimitFor(request)).isEqualTo(10);
    assertThat(properties.allotmentFor(request)).isEqualTo(0.5);
  }

  @Test
  void perSourceLimitIsAtLeastOne() {
    properties.setOverFetchFactor(1);
    SearchRequest request = SearchRequest.builder("q").maxResults(1).fastMode(true).build();

    assertThat(properties.perSourceLimitFor(request)).isEqualTo(1);
  }

  @Test
  void unknownFallbackSourceFailsValidation() {
    properties.setFallbackChain(List.of("arxiv", "scopus"));

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("scopus");
  }

  @Test
  void nonPositiveTimeoutFailsValidation() {
    properties.setDefaultTimeout(Duration.ZERO);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void allotmentOutsideUnitIntervalFailsValidation() {
    properties.setSourceAllotment(1.5);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("source-allotment");
  }
}
