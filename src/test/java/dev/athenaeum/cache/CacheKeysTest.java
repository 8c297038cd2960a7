package dev.athenaeum.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CacheKeysTest {

  @Test
  void keyIsLowercaseHexSha256() {
    assertThat(CacheKeys.forSourceQuery("openalex", "graph neural networks", 40, null))
        .hasSize(64)
        .matches("[0-9a-f]+");
  }

  @Test
  void sha256MatchesKnownDigest() {
    assertThat(CacheKeys.sha256("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void queryCaseAndSpacingDoNotChangeKey() {
    assertThat(CacheKeys.forSourceQuery("arxiv", "  Graph   Neural Networks ", 10, 2020))
        .isEqualTo(CacheKeys.forSourceQuery("arxiv", "graph neural networks", 10, 2020));
  }

  @Test
  void sourceLimitAndYearAreKeyParts() {
    String base = CacheKeys.forSourceQuery("arxiv", "q", 10, null);

    assertThat(CacheKeys.forSourceQuery("crossref", "q", 10, null)).isNotEqualTo(base);
    assertThat(CacheKeys.forSourceQuery("arxiv", "q", 20, null)).isNotEqualTo(base);
    assertThat(CacheKeys.forSourceQuery("arxiv", "q", 10, 2015)).isNotEqualTo(base);
  }
}
