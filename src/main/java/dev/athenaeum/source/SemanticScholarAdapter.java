package dev.athenaeum.source;

import com.fasterxml.jackson.databind.JsonNode;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.PublicationYears;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

/**
 * Semantic Scholar Graph API paper search. The {@code x-api-key} header is set on the client bean
 * when a key is configured; without one the shared public rate limit applies.
 */
@Component
public class SemanticScholarAdapter extends AbstractSourceAdapter {

  static final String FIELDS =
      "title,abstract,year,venue,externalIds,url,citationCount,authors,openAccessPdf,publicationDate";

  public SemanticScholarAdapter(
      @Qualifier("semanticScholarRestClient") RestClient restClient, SourceSupport support) {
    super(restClient, support);
  }

  @Override
  public PaperSource source() {
    return PaperSource.SEMANTIC_SCHOLAR;
  }

  @Override
  protected List<RawResult> doSearch(String query, SourceQuery options) {
    JsonNode body =
        exchange(
            () ->
                restClient
                    .get()
                    .uri(
                        uriBuilder -> {
                          UriBuilder builder =
                              uriBuilder
                                  .path("/graph/v1/paper/search")
                                  .queryParam("query", "{query}")
                                  .queryParam("limit", options.limit())
                                  .queryParam("fields", FIELDS);
                          if (options.fromYear() != null) {
                            builder.queryParam("year", options.fromYear() + "-");
                          }
                          return builder.build(Map.of("query", query));
                        })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, statusHandler())
                    .body(JsonNode.class));

    List<RawResult> results = new ArrayList<>();
    if (body == null) {
      return results;
    }
    for (JsonNode paper : body.path("data")) {
      RawResult result = toRawResult(paper);
      if (result != null) {
        results.add(result);
      }
    }
    return results;
  }

  private @Nullable RawResult toRawResult(JsonNode paper) {
    String title = JsonFields.text(paper, "title");
    if (title == null) {
      return null;
    }
    RawResult.Builder builder =
        RawResult.builder()
            .source(PaperSource.SEMANTIC_SCHOLAR)
            .title(title)
            .year(
                PublicationYears.resolve(
                    JsonFields.integer(paper, "year"), JsonFields.text(paper, "publicationDate")))
            .abstractText(JsonFields.text(paper, "abstract"))
            .venue(JsonFields.text(paper, "venue"))
            .doi(JsonFields.text(paper.path("externalIds"), "DOI"))
            .url(JsonFields.text(paper, "url"))
            .pdfUrl(JsonFields.text(paper.path("openAccessPdf"), "url"))
            .citationCount(JsonFields.integer(paper, "citationCount"));
    for (JsonNode author : paper.path("authors")) {
      builder.author(JsonFields.text(author, "name"));
    }
    return builder.build();
  }
}
