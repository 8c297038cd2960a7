package dev.athenaeum.source;

import com.fasterxml.jackson.databind.JsonNode;
import dev.athenaeum.paper.PaperSource;
import dev.athenaeum.paper.PublicationYears;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * CORE v3 works search. Requests are POSTed with a bearer token configured on the client bean;
 * {@link SourceProperties#validate()} refuses to start with CORE enabled and no key.
 */
@Component
public class CoreAdapter extends AbstractSourceAdapter {

  public CoreAdapter(@Qualifier("coreRestClient") RestClient restClient, SourceSupport support) {
    super(restClient, support);
  }

  @Override
  public PaperSource source() {
    return PaperSource.CORE;
  }

  @Override
  protected List<RawResult> doSearch(String query, SourceQuery options) {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("q", searchQuery(query, options.fromYear()));
    request.put("limit", options.limit());
    request.put("offset", 0);

    JsonNode body =
        exchange(
            () ->
                restClient
                    .post()
                    .uri("/v3/search/works")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
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

  static String searchQuery(String query, @Nullable Integer fromYear) {
    String phrase = query.replace("\"", " ").trim();
    String searchQuery = "(title:\"" + phrase + "\" OR abstract:\"" + phrase + "\")";
    if (fromYear != null) {
      searchQuery += " AND yearPublished>=" + fromYear;
    }
    return searchQuery;
  }

  private @Nullable RawResult toRawResult(JsonNode work) {
    String title = JsonFields.text(work, "title");
    if (title == null) {
      return null;
    }
    String downloadUrl = JsonFields.text(work, "downloadUrl");
    RawResult.Builder builder =
        RawResult.builder()
            .source(PaperSource.CORE)
            .title(title)
            .year(
                PublicationYears.resolve(
                    JsonFields.integer(work, "yearPublished"),
                    JsonFields.text(work, "publishedDate")))
            .abstractText(JsonFields.text(work, "abstract"))
            .venue(JsonFields.text(work, "publisher"))
            .doi(JsonFields.text(work, "doi"))
            .url(downloadUrl)
            .pdfUrl(downloadUrl)
            .citationCount(JsonFields.integer(work, "citationCount"));
    for (JsonNode author : work.path("authors")) {
      builder.author(JsonFields.text(author, "name"));
    }
    return builder.build();
  }
}
