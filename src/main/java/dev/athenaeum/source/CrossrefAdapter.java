package dev.athenaeum.source;

import com.fasterxml.jackson.databind.JsonNode;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

/** Crossref {@code /works} bibliographic search. Abstracts are JATS XML and get their tags stripped. */
@Component
public class CrossrefAdapter extends AbstractSourceAdapter {

  private static final Pattern MARKUP = Pattern.compile("<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final List<String> DATE_FIELDS =
      List.of("published", "published-print", "published-online", "issued", "created");

  public CrossrefAdapter(
      @Qualifier("crossrefRestClient") RestClient restClient, SourceSupport support) {
    super(restClient, support);
  }

  @Override
  public PaperSource source() {
    return PaperSource.CROSSREF;
  }

  @Override
  protected List<RawResult> doSearch(String query, SourceQuery options) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("query", query);
    variables.put("mailto", support.properties().getContactEmail());

    JsonNode body =
        exchange(
            () ->
                restClient
                    .get()
                    .uri(
                        uriBuilder -> {
                          UriBuilder builder =
                              uriBuilder
                                  .path("/works")
                                  .queryParam("query.bibliographic", "{query}")
                                  .queryParam("rows", options.limit())
                                  .queryParam("mailto", "{mailto}");
                          if (options.fromYear() != null) {
                            builder.queryParam(
                                "filter", "from-pub-date:" + options.fromYear() + "-01-01");
                          }
                          return builder.build(variables);
                        })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, statusHandler())
                    .body(JsonNode.class));

    List<RawResult> results = new ArrayList<>();
    if (body == null) {
      return results;
    }
    for (JsonNode item : body.path("message").path("items")) {
      RawResult result = toRawResult(item);
      if (result != null) {
        results.add(result);
      }
    }
    return results;
  }

  private @Nullable RawResult toRawResult(JsonNode item) {
    String title = JsonFields.firstText(item, "title");
    if (title == null) {
      return null;
    }
    RawResult.Builder builder =
        RawResult.builder()
            .source(PaperSource.CROSSREF)
            .title(title)
            .year(year(item))
            .abstractText(stripMarkup(JsonFields.text(item, "abstract")))
            .venue(JsonFields.firstText(item, "container-title"))
            .doi(JsonFields.text(item, "DOI"))
            .url(JsonFields.text(item, "URL"))
            .citationCount(JsonFields.integer(item, "is-referenced-by-count"));
    for (JsonNode link : item.path("link")) {
      if ("application/pdf".equals(JsonFields.text(link, "content-type"))) {
        builder.pdfUrl(JsonFields.text(link, "URL"));
        break;
      }
    }
    for (JsonNode author : item.path("author")) {
      String given = JsonFields.text(author, "given");
      String family = JsonFields.text(author, "family");
      String name = ((given == null ? "" : given) + " " + (family == null ? "" : family)).trim();
      if (name.isEmpty()) {
        name = JsonFields.text(author, "name");
      }
      builder.author(name);
    }
    return builder.build();
  }

  /** Year from the first date field carrying {@code date-parts[0][0]}. */
  static @Nullable Integer year(JsonNode item) {
    for (String field : DATE_FIELDS) {
      JsonNode first = item.path(field).path("date-parts").path(0).path(0);
      if (first.canConvertToInt() && first.asInt() > 0) {
        return first.asInt();
      }
    }
    return null;
  }

  static @Nullable String stripMarkup(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String plain = WHITESPACE.matcher(MARKUP.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
    return plain.isEmpty() ? null : plain;
  }
}
