package dev.athenaeum.paper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RawResultTest {

  @Test
  void builderComputesCanonicalIdFromDoi() {
    RawResult result =
        RawResult.builder()
            .title("Paper")
            .doi("https://doi.org/10.5555/ABC")
            .source(PaperSource.CROSSREF)
            .build();

    assertThat(result.canonicalId()).isEqualTo(CanonicalIds.forPaper("10.5555/abc", "x", null, null));
  }

  @Test
  void builderComputesCanonicalIdFromTitleAuthorAndYear() {
    RawResult result =
        RawResult.builder()
            .title("Paper")
            .author("Grace Hopper")
            .year(1952)
            .source(PaperSource.ARXIV)
            .build();

    assertThat(result.canonicalId())
        .isEqualTo(CanonicalIds.forPaper(null, "Paper", "Grace Hopper", 1952));
  }

  @Test
  void builderKeepsExplicitCanonicalId() {
    RawResult result =
        RawResult.builder().title("Paper").canonicalId("given-id").source(PaperSource.CORE).build();

    assertThat(result.canonicalId()).isEqualTo("given-id");
  }

  @Test
  void builderTurnsBlankOptionalFieldsIntoNull() {
    RawResult result =
        RawResult.builder()
            .title("  Paper  ")
            .abstractText("  ")
            .venue("")
            .doi(" ")
            .source(PaperSource.OPENALEX)
            .build();

    assertThat(result.title()).isEqualTo("Paper");
    assertThat(result.abstractText()).isNull();
    assertThat(result.venue()).isNull();
    assertThat(result.doi()).isNull();
    assertThat(result.hasDoi()).isFalse();
  }

  @Test
  void blankTitleIsRejected() {
    assertThatThrownBy(() -> RawResult.builder().title(" ").source(PaperSource.OPENALEX).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Title");
  }

  @Test
  void missingSourceIsRejected() {
    assertThatThrownBy(() -> RawResult.builder().title("Paper").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Source");
  }

  @Test
  void missingAuthorNameBecomesPlaceholder() {
    RawResult result =
        RawResult.builder().title("Paper").author(null).source(PaperSource.OPENALEX).build();

    assertThat(result.authors()).containsExactly(new Author(Author.UNKNOWN_NAME));
    assertThat(result.firstAuthorName()).isEqualTo(Author.UNKNOWN_NAME);
  }

  @Test
  void authorListIsImmutable() {
    RawResult result =
        RawResult.builder()
            .title("Paper")
            .authors(List.of(Author.of("A")))
            .source(PaperSource.OPENALEX)
            .build();

    assertThatThrownBy(() -> result.authors().add(Author.of("B")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void isArxivByLandingPage() {
    RawResult result =
        RawResult.builder()
            .title("Paper")
            .url("https://arxiv.org/abs/2101.00001")
            .source(PaperSource.SEMANTIC_SCHOLAR)
            .build();

    assertThat(result.isArxiv()).isTrue();
  }

  @Test
  void citationsOrZeroReadsMissingAsZero() {
    RawResult result = RawResult.builder().title("Paper").source(PaperSource.ARXIV).build();

    assertThat(result.citationCount()).isNull();
    assertThat(result.citationsOrZero()).isZero();
  }
}
