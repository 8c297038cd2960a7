package dev.athenaeum.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.athenaeum.fixture.SourceSupportFixture;
import dev.athenaeum.paper.RawResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SemanticScholarAdapterTest {

  private static final String SEARCH_URL = "https://api.semanticscholar.org/graph/v1/paper/search";

  private MockRestServiceServer server;
  private SemanticScholarAdapter adapter;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("https://api.semanticscholar.org");
    server = MockRestServiceServer.bindTo(builder).build();
    adapter = new SemanticScholarAdapter(builder.build(), SourceSupportFixture.support());
  }

  @Test
  void mapsPapersToRawResults() {
    server
        .expect(once(), requestTo(startsWith(SEARCH_URL)))
        .andExpect(queryParam("limit", "3"))
        .andExpect(queryParam("year", "2019-"))
        .andRespond(
            withSuccess(
                """
                {
                  "total": 1,
                  "data": [
                    {
                      "paperId": "abc",
                      "title": "BERT: Pre-training of Deep Bidirectional Transformers",
                      "abstract": "We introduce BERT.",
                      "year": null,
                      "publicationDate": "2019-05-24",
                      "venue": "NAACL",
                      "externalIds": {"DOI": "10.18653/v1/N19-1423", "ArXiv": "1810.04805"},
                      "url": "https://www.semanticscholar.org/paper/abc",
                      "citationCount": 90000,
                      "openAccessPdf": {"url": "https://aclanthology.org/N19-1423.pdf"},
                      "authors": [{"name": "Jacob Devlin"}, {"name": "Ming-Wei Chang"}]
                    }
                  ]
                }
                """,
                MediaType.APPLICATION_JSON));

    SourceFetchResult result = adapter.fetch("bert", new SourceQuery(3, 2019, false));

    server.verify();
    RawResult paper = result.results().get(0);
    assertThat(paper.year()).isEqualTo(2019);
    assertThat(paper.doi()).isEqualTo("10.18653/v1/N19-1423");
    assertThat(paper.pdfUrl()).isEqualTo("https://aclanthology.org/N19-1423.pdf");
    assertThat(paper.venue()).isEqualTo("NAACL");
    assertThat(paper.citationCount()).isEqualTo(90000);
    assertThat(paper.firstAuthorName()).isEqualTo("Jacob Devlin");
  }

  @Test
  void missingDataArrayYieldsEmptySuccess() {
    server
        .expect(once(), requestTo(startsWith(SEARCH_URL)))
        .andRespond(withSuccess("{\"total\": 0}", MediaType.APPLICATION_JSON));

    SourceFetchResult result = adapter.fetch("nothing", SourceQuery.of(3));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.results()).isEmpty();
  }

  @Test
  void forbiddenIsReportedWithoutRetry() {
    server
        .expect(once(), requestTo(startsWith(SEARCH_URL)))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    SourceFetchResult result = adapter.fetch("bert", SourceQuery.of(3));

    server.verify();
    assertThat(result.error()).isEqualTo("semantic_scholar returned HTTP 403");
  }
}
