package dev.athenaeum.source;

import com.fasterxml.jackson.databind.JsonNode;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.PublicationYears;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * OpenAlex {@code /works} search. Abstracts arrive as an inverted index (word to positions) and are
 * rebuilt into plain text.
 */
@Component
public class OpenAlexAdapter extends AbstractSourceAdapter {

  static final String WORK_TYPES = "type:journal-article|preprint|proceedings-article";

  public OpenAlexAdapter(
      @Qualifier("openAlexRestClient") RestClient restClient, SourceSupport support) {
    super(restClient, support);
  }

  @Override
  public PaperSource source() {
    return PaperSource.OPENALEX;
  }

  @Override
  protected List<RawResult> doSearch(String query, SourceQuery options) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("query", query);
    variables.put("filter", filter(options.fromYear()));
    variables.put("mailto", support.properties().getContactEmail());

    JsonNode body =
        exchange(
            () ->
                restClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path("/works")
                                .queryParam("search", "{query}")
                                .queryParam("per_page", options.limit())
                                .queryParam("filter", "{filter}")
                                .queryParam("mailto", "{mailto}")
                                .build(variables))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, statusHandler())
                    .body(JsonNode.class));

    List<RawResult> results = new ArrayList<>();
    if (body == null) {
      return results;
    }
    for (JsonNode work : body.path("results")) {
      RawResult result = toRawResult(work);
      if (result != null) {
        results.add(result);
      }
    }
    return results;
  }

  static String filter(@Nullable Integer fromYear) {
    if (fromYear == null) {
      return WORK_TYPES;
    }
    return "from_publication_date:" + fromYear + "-01-01," + WORK_TYPES;
  }

  private @Nullable RawResult toRawResult(JsonNode work) {
    String title = JsonFields.text(work, "display_name");
    if (title == null) {
      title = JsonFields.text(work, "title");
    }
    if (title == null) {
      return null;
    }
    JsonNode primaryLocation = work.path("primary_location");
    RawResult.Builder builder =
        RawResult.builder()
            .source(PaperSource.OPENALEX)
            .title(title)
            .year(
                PublicationYears.resolve(
                    JsonFields.integer(work, "publication_year"),
                    JsonFields.text(work, "publication_date")))
            .abstractText(reconstructAbstract(work.path("abstract_inverted_index")))
            .venue(JsonFields.text(primaryLocation.path("source"), "display_name"))
            .doi(JsonFields.text(work, "doi"))
            .url(JsonFields.text(primaryLocation, "landing_page_url"))
            .pdfUrl(JsonFields.text(primaryLocation, "pdf_url"))
            .citationCount(JsonFields.integer(work, "cited_by_count"));
    for (JsonNode authorship : work.path("authorships")) {
      builder.author(JsonFields.text(authorship.path("author"), "display_name"));
    }
    return builder.build();
  }

  /**
   * Rebuilds abstract text from OpenAlex's {@code abstract_inverted_index}.
   *
   * @param invertedIndex object mapping each word to the positions it occupies
   * @return the abstract, or null when the index is absent or empty
   */
  static @Nullable String reconstructAbstract(JsonNode invertedIndex) {
    if (invertedIndex == null || !invertedIndex.isObject() || invertedIndex.isEmpty()) {
      return null;
    }
    TreeMap<Integer, String> byPosition = new TreeMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = invertedIndex.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      for (JsonNode position : entry.getValue()) {
        if (position.canConvertToInt()) {
          byPosition.put(position.asInt(), entry.getKey());
        }
      }
    }
    String text = String.join(" ", byPosition.values()).replaceAll("\\s+", " ").trim();
    return text.isEmpty() ? null : text;
  }
}
