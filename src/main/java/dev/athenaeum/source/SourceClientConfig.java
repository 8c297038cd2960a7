package dev.athenaeum.source;

import java.net.http.HttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures one {@link RestClient} per external source, qualified by name.
 *
 * <p>Clients use the JDK {@link HttpClient} request factory: interrupting a thread blocked in an
 * exchange aborts the request, which is how the orchestrator cancels sources that overrun their
 * time allotment. Base URLs, keys and timeouts come from {@link SourceProperties}.
 */
@Configuration
public class SourceClientConfig {

  @Bean
  public RestClient openAlexRestClient(RestClient.Builder builder, SourceProperties properties) {
    return baseClient(builder, properties, properties.getOpenalex()).build();
  }

  @Bean
  public RestClient crossrefRestClient(RestClient.Builder builder, SourceProperties properties) {
    return baseClient(builder, properties, properties.getCrossref()).build();
  }

  /** Sends {@code x-api-key} when a Semantic Scholar key is configured. */
  @Bean
  public RestClient semanticScholarRestClient(
      RestClient.Builder builder, SourceProperties properties) {
    SourceProperties.Vendor vendor = properties.getSemanticScholar();
    RestClient.Builder configured = baseClient(builder, properties, vendor);
    if (vendor.getApiKey() != null && !vendor.getApiKey().isBlank()) {
      configured.defaultHeader("x-api-key", vendor.getApiKey());
    }
    return configured.build();
  }

  @Bean
  public RestClient arxivRestClient(RestClient.Builder builder, SourceProperties properties) {
    return baseClient(builder, properties, properties.getArxiv())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_ATOM_XML_VALUE)
        .build();
  }

  /** Authenticates with the CORE bearer token; startup validation guarantees one when enabled. */
  @Bean
  public RestClient coreRestClient(RestClient.Builder builder, SourceProperties properties) {
    SourceProperties.Vendor vendor = properties.getCore();
    RestClient.Builder configured = baseClient(builder, properties, vendor);
    if (vendor.getApiKey() != null && !vendor.getApiKey().isBlank()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + vendor.getApiKey());
    }
    return configured.build();
  }

  /** Empty in-memory store used until a persistent implementation is wired in. */
  @Bean
  @ConditionalOnMissingBean
  public InternalPaperStore internalPaperStore() {
    return new InMemoryPaperStore();
  }

  private static RestClient.Builder baseClient(
      RestClient.Builder builder, SourceProperties properties, SourceProperties.Vendor vendor) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(vendor.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(vendor.getReadTimeout());

    return builder
        .clone()
        .baseUrl(vendor.getBaseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(
            HttpHeaders.USER_AGENT, "Athenaeum/0.1 (mailto:" + properties.getContactEmail() + ")");
  }
}
