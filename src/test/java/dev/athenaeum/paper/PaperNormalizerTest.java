package dev.athenaeum.paper;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PaperNormalizerTest {

  @Test
  void normalizeTitleLowercasesStripsPunctuationAndCollapsesWhitespace() {
    assertThat(PaperNormalizer.normalizeTitle("  Attention Is   All You Need!  "))
        .isEqualTo("attention is all you need");
  }

  @Test
  void normalizeTitleKeepsNonLatinLettersAndDigits() {
    assertThat(PaperNormalizer.normalizeTitle("Über GPT-4: Résumé")).isEqualTo("über gpt4 résumé");
  }

  @Test
  void normalizeTitleReturnsEmptyForNull() {
    assertThat(PaperNormalizer.normalizeTitle(null)).isEmpty();
  }

  @Test
  void normalizeTitleIsIdempotent() {
    String once = PaperNormalizer.normalizeTitle("A  Study, of: THINGS.");
    assertThat(PaperNormalizer.normalizeTitle(once)).isEqualTo(once);
  }

  @Test
  void normalizeDoiStripsResolverPrefixesAndLowercases() {
    assertThat(PaperNormalizer.normalizeDoi("https://doi.org/10.1000/ABC")).isEqualTo("10.1000/abc");
    assertThat(PaperNormalizer.normalizeDoi("http://dx.doi.org/10.1000/abc")).isEqualTo("10.1000/abc");
    assertThat(PaperNormalizer.normalizeDoi("doi:10.1000/Abc")).isEqualTo("10.1000/abc");
    assertThat(PaperNormalizer.normalizeDoi(" 10.1000/abc ")).isEqualTo("10.1000/abc");
  }

  @Test
  void normalizeDoiReturnsNullForBlankInput() {
    assertThat(PaperNormalizer.normalizeDoi(null)).isNull();
    assertThat(PaperNormalizer.normalizeDoi("   ")).isNull();
    assertThat(PaperNormalizer.normalizeDoi("https://doi.org/")).isNull();
  }

  @Test
  void normalizeAuthorTreatsPlaceholderAsEmpty() {
    assertThat(PaperNormalizer.normalizeAuthor(Author.UNKNOWN_NAME)).isEmpty();
    assertThat(PaperNormalizer.normalizeAuthor("J. R. R. Tolkien")).isEqualTo("j r r tolkien");
  }

  @Test
  void isArxivUrlRecognisesAbsAndPdfPages() {
    assertThat(PaperNormalizer.isArxivUrl("http://arxiv.org/abs/1706.03762v5")).isTrue();
    assertThat(PaperNormalizer.isArxivUrl("https://export.arxiv.org/pdf/1706.03762")).isTrue();
    assertThat(PaperNormalizer.isArxivUrl("https://doi.org/10.48550/arXiv.1706.03762")).isFalse();
    assertThat(PaperNormalizer.isArxivUrl(null)).isFalse();
  }
}
