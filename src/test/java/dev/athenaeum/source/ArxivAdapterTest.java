package dev.athenaeum.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.athenaeum.fixture.SourceSupportFixture;
import dev.athenaeum.paper.Author;
import dev.athenaeum.paper.RawResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ArxivAdapterTest {

  private static final String TWO_ENTRY_FEED =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <feed xmlns="http://www.w3.org/2005/Atom">
        <title type="html">ArXiv Query: search_query=all:attention</title>
        <entry>
          <id>http://arxiv.org/abs/1706.03762v7</id>
          <published>2017-06-12T17:57:34Z</published>
          <title>Attention Is All
            You Need</title>
          <summary>  The dominant sequence transduction models
            are based on recurrent networks.</summary>
          <author><name>Ashish Vaswani</name></author>
          <author><name>Noam Shazeer</name></author>
          <arxiv:doi xmlns:arxiv="http://arxiv.org/schemas/atom">10.48550/arXiv.1706.03762</arxiv:doi>
          <link href="http://arxiv.org/abs/1706.03762v7" rel="alternate" type="text/html"/>
          <link title="pdf" href="http://arxiv.org/pdf/1706.03762v7" rel="related" type="application/pdf"/>
        </entry>
        <entry>
          <id>http://arxiv.org/abs/2005.14165v4</id>
          <published>2020-05-28T17:29:03Z</published>
          <title>Language Models are Few-Shot Learners</title>
          <summary>We show that scaling up language models improves few-shot performance.</summary>
          <author><name>Tom B. Brown</name></author>
          <link href="http://arxiv.org/abs/2005.14165v4" rel="alternate" type="text/html"/>
        </entry>
      </feed>
      """;

  private MockRestServiceServer server;
  private ArxivAdapter adapter;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("https://export.arxiv.org");
    server = MockRestServiceServer.bindTo(builder).build();
    adapter = new ArxivAdapter(builder.build(), SourceSupportFixture.support());
  }

  @Test
  void parsesAtomFeedEntries() {
    server
        .expect(once(), requestTo(startsWith("https://export.arxiv.org/api/query")))
        .andExpect(queryParam("max_results", "10"))
        .andRespond(withSuccess(TWO_ENTRY_FEED, MediaType.APPLICATION_ATOM_XML));

    SourceFetchResult result = adapter.fetch("attention", SourceQuery.of(10));

    server.verify();
    assertThat(result.results()).hasSize(2);
    RawResult first = result.results().get(0);
    assertThat(first.title()).isEqualTo("Attention Is All You Need");
    assertThat(first.abstractText())
        .isEqualTo("The dominant sequence transduction models are based on recurrent networks.");
    assertThat(first.year()).isEqualTo(2017);
    assertThat(first.venue()).isEqualTo("arXiv");
    assertThat(first.doi()).isEqualTo("10.48550/arXiv.1706.03762");
    assertThat(first.url()).isEqualTo("http://arxiv.org/abs/1706.03762v7");
    assertThat(first.pdfUrl()).isEqualTo("http://arxiv.org/pdf/1706.03762v7");
    assertThat(first.authors())
        .containsExactly(Author.of("Ashish Vaswani"), Author.of("Noam Shazeer"));
    assertThat(first.isArxiv()).isTrue();

    RawResult second = result.results().get(1);
    assertThat(second.authors()).containsExactly(Author.of("Tom B. Brown"));
    assertThat(second.pdfUrl()).isNull();
  }

  @Test
  void singleEntryFeedIsStillAList() {
    List<RawResult> results =
        adapter.parseFeed(
            """
            <feed xmlns="http://www.w3.org/2005/Atom">
              <entry>
                <id>http://arxiv.org/abs/1234.5678v1</id>
                <published>2012-01-01T00:00:00Z</published>
                <title>Only One</title>
                <author><name>Solo Author</name></author>
              </entry>
            </feed>
            """);

    assertThat(results).extracting(RawResult::title).containsExactly("Only One");
    assertThat(results.get(0).firstAuthorName()).isEqualTo("Solo Author");
  }

  @Test
  void emptyFeedYieldsNoResults() {
    assertThat(adapter.parseFeed("<feed xmlns=\"http://www.w3.org/2005/Atom\"></feed>")).isEmpty();
  }

  @Test
  void malformedXmlIsParseError() {
    assertThatThrownBy(() -> adapter.parseFeed("<feed><entry>"))
        .isInstanceOf(SourceParseException.class);
  }

  @Test
  void searchQueryQuotesPhraseAndAddsDateRange() {
    assertThat(ArxivAdapter.searchQuery("graph \"neural\" nets", null))
        .isEqualTo("all:\"graph  neural  nets\"");
    assertThat(ArxivAdapter.searchQuery("gnn", 2020))
        .isEqualTo("all:\"gnn\" AND submittedDate:[202001010000 TO 999912312359]");
  }
}
