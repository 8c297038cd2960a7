package dev.athenaeum.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import dev.athenaeum.fixture.RawResultBuilder;
import dev.athenaeum.paper.CanonicalPaper;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TokenBudgetTruncatorTest {

  private static CanonicalPaper paper(RawResultBuilder builder) {
    return CanonicalPaper.from(builder.build(), Set.of(), null, 0.5);
  }

  @Test
  void paperBlockListsCitationFields() {
    var truncator = new TokenBudgetTruncator(5000);
    var paper =
        CanonicalPaper.from(
                new RawResultBuilder()
                    .title("Attention Is All You Need")
                    .authors("Ashish Vaswani", "Noam Shazeer")
                    .year(2017)
                    .venue("NeurIPS")
                    .doi("10.5555/3295222.3295349")
                    .url("https://papers.nips.cc/paper/7181")
                    .citations(60000)
                    .build(),
                Set.of(),
                "https://arxiv.org/abs/1706.03762",
                0.8766)
            .withRegion("United States");

    String output = truncator.truncate(List.of(paper));

    assertThat(output).startsWith("## [1] Attention Is All You Need (2017)\n");
    assertThat(output).contains("Authors: Ashish Vaswani, Noam Shazeer\n");
    assertThat(output).contains("Venue: NeurIPS\n");
    assertThat(output).contains("DOI: 10.5555/3295222.3295349\n");
    assertThat(output).contains("URL: https://papers.nips.cc/paper/7181\n");
    assertThat(output).contains("Preprint: https://arxiv.org/abs/1706.03762\n");
    assertThat(output).contains("Region: United States\n");
    assertThat(output).contains("Source: openalex | Citations: 60000 | Score: 0.877\n");
    assertThat(output).contains("We study protein structure prediction.");
    assertThat(output).endsWith("\n---\n");
    assertThat(output).doesNotContain("PDF:");
  }

  @Test
  void longAuthorListsAreAbbreviated() {
    var truncator = new TokenBudgetTruncator(5000);
    var paper = paper(new RawResultBuilder().authors("A", "B", "C", "D", "E", "F", "G"));

    assertThat(truncator.truncate(List.of(paper))).contains("Authors: A, B, C, D, E, et al.\n");
  }

  @Test
  void missingAuthorsAndCitationsAreShownAsDefaults() {
    var truncator = new TokenBudgetTruncator(5000);
    var paper = paper(new RawResultBuilder().authors().citations(null).year(null));

    String output = truncator.truncate(List.of(paper));

    assertThat(output).startsWith("## [1] Deep Learning for Protein Folding\n");
    assertThat(output).contains("Authors: unknown\n");
    assertThat(output).contains("Citations: 0 |");
  }

  @Test
  void papersAreNumberedInOrder() {
    var truncator = new TokenBudgetTruncator(5000);

    String output =
        truncator.truncate(
            List.of(
                paper(new RawResultBuilder().title("First")),
                paper(new RawResultBuilder().title("Second"))));

    assertThat(output.indexOf("## [1] First")).isLessThan(output.indexOf("## [2] Second"));
  }

  @Test
  void papersBeyondBudgetAreDropped() {
    // 60 tokens is about 240 chars; one block is roughly 150.
    var truncator = new TokenBudgetTruncator(60);

    String output =
        truncator.truncate(
            List.of(
                paper(new RawResultBuilder().title("First")),
                paper(new RawResultBuilder().title("Second")),
                paper(new RawResultBuilder().title("Third"))));

    assertThat(output).contains("First");
    assertThat(output).doesNotContain("Third");
  }

  @Test
  void oversizedFirstPaperIsCutToBudget() {
    var truncator = new TokenBudgetTruncator(10);

    String output =
        truncator.truncate(List.of(paper(new RawResultBuilder().abstractText("x".repeat(500)))));

    assertThat(output).isNotEmpty();
    assertThat(output.length()).isLessThanOrEqualTo(40);
    assertThat(output).startsWith("## [1]");
  }

  @Test
  void emptyOrNullInputYieldsEmptyString() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.truncate(Collections.emptyList())).isEmpty();
    assertThat(truncator.truncate(null)).isEmpty();
  }

  @Test
  void tokensAreEstimatedAsQuarterOfCharacters() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.estimateTokens("abcd")).isEqualTo(1);
    assertThat(truncator.estimateTokens("abcde")).isEqualTo(2);
    assertThat(truncator.getTokenBudget()).isEqualTo(5000);
  }
}
