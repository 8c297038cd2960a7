package dev.athenaeum.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
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

/**
 * arXiv export API search. The response is an Atom feed read as a tree with Jackson XML; a feed
 * with a single entry yields an object instead of an array, which {@link JsonFields#elements}
 * absorbs.
 */
@Component
public class ArxivAdapter extends AbstractSourceAdapter {

  static final String VENUE = "arXiv";

  private final XmlMapper xmlMapper = new XmlMapper();

  public ArxivAdapter(@Qualifier("arxivRestClient") RestClient restClient, SourceSupport support) {
    super(restClient, support);
  }

  @Override
  public PaperSource source() {
    return PaperSource.ARXIV;
  }

  @Override
  protected List<RawResult> doSearch(String query, SourceQuery options) {
    String searchQuery = searchQuery(query, options.fromYear());
    String xml =
        exchange(
            () ->
                restClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path("/api/query")
                                .queryParam("search_query", "{searchQuery}")
                                .queryParam("start", 0)
                                .queryParam("max_results", options.limit())
                                .queryParam("sortBy", "relevance")
                                .queryParam("sortOrder", "descending")
                                .build(Map.of("searchQuery", searchQuery)))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, statusHandler())
                    .body(String.class));
    if (xml == null || xml.isBlank()) {
      return List.of();
    }
    return parseFeed(xml);
  }

  static String searchQuery(String query, @Nullable Integer fromYear) {
    String phrase = query.replace("\"", " ").trim();
    String searchQuery = "all:\"" + phrase + "\"";
    if (fromYear != null) {
      searchQuery += " AND submittedDate:[" + fromYear + "01010000 TO 999912312359]";
    }
    return searchQuery;
  }

  List<RawResult> parseFeed(String xml) {
    JsonNode feed;
    try {
      feed = xmlMapper.readTree(xml);
    } catch (JsonProcessingException e) {
      throw new SourceParseException(
          PaperSource.ARXIV, "arxiv returned malformed Atom XML: " + e.getOriginalMessage(), e);
    }
    List<RawResult> results = new ArrayList<>();
    for (JsonNode entry : JsonFields.elements(feed, "entry")) {
      RawResult result = toRawResult(entry);
      if (result != null) {
        results.add(result);
      }
    }
    return results;
  }

  private @Nullable RawResult toRawResult(JsonNode entry) {
    String title = collapse(JsonFields.text(entry, "title"));
    if (title == null) {
      return null;
    }
    RawResult.Builder builder =
        RawResult.builder()
            .source(PaperSource.ARXIV)
            .title(title)
            .year(PublicationYears.fromDateString(JsonFields.text(entry, "published")))
            .abstractText(collapse(JsonFields.text(entry, "summary")))
            .venue(VENUE)
            .doi(JsonFields.text(entry, "doi"))
            .url(JsonFields.text(entry, "id"));
    for (JsonNode link : JsonFields.elements(entry, "link")) {
      if ("application/pdf".equals(JsonFields.text(link, "type"))) {
        builder.pdfUrl(JsonFields.text(link, "href"));
        break;
      }
    }
    for (JsonNode author : JsonFields.elements(entry, "author")) {
      builder.author(collapse(JsonFields.text(author, "name")));
    }
    return builder.build();
  }

  private static @Nullable String collapse(@Nullable String text) {
    return text == null ? null : text.replaceAll("\\s+", " ").trim();
  }
}
