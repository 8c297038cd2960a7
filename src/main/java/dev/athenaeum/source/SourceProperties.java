package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the bibliographic sources, bound from {@code athenaeum.sources.*}.
 *
 * <p>Each vendor has its own block ({@code openalex}, {@code crossref}, {@code semantic-scholar},
 * {@code arxiv}, {@code core}, {@code internal}) with {@code enabled}, {@code base-url}, {@code
 * api-key}, {@code min-interval}, {@code connect-timeout} and {@code read-timeout}. Shared retry and
 * circuit breaker settings live under {@code retry} and {@code circuit-breaker}.
 *
 * <p>Validated at startup via {@link #validate()}; CORE enabled without an API key fails the
 * application with a {@link SourceConfigurationException}.
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.sources")
public class SourceProperties {

  private String contactEmail = "research@example.com";
  private Vendor openalex = new Vendor("https://api.openalex.org");
  private Vendor crossref = new Vendor("https://api.crossref.org");
  private Vendor semanticScholar = new Vendor("https://api.semanticscholar.org");
  private Vendor arxiv = new Vendor("https://export.arxiv.org");
  private Vendor core = new Vendor("https://api.core.ac.uk", false);
  private Vendor internal = new Vendor("", true);
  private Retry retry = new Retry();
  private Breaker circuitBreaker = new Breaker();

  @PostConstruct
  void validate() {
    if (core.isEnabled() && (core.getApiKey() == null || core.getApiKey().isBlank())) {
      throw new SourceConfigurationException(
          "athenaeum.sources.core.api-key must be set when the CORE source is enabled");
    }
    if (retry.getMaxAttempts() < 1) {
      throw new IllegalStateException(
          "athenaeum.sources.retry.max-attempts must be at least 1, got: "
              + retry.getMaxAttempts());
    }
    if (retry.getMultiplier() < 1.0) {
      throw new IllegalStateException(
          "athenaeum.sources.retry.multiplier must be >= 1.0, got: " + retry.getMultiplier());
    }
    if (circuitBreaker.getFailureThreshold() < 1) {
      throw new IllegalStateException(
          "athenaeum.sources.circuit-breaker.failure-threshold must be at least 1, got: "
              + circuitBreaker.getFailureThreshold());
    }
  }

  /** Settings block for the given source. */
  public Vendor vendor(PaperSource source) {
    return switch (source) {
      case OPENALEX -> openalex;
      case CROSSREF -> crossref;
      case SEMANTIC_SCHOLAR -> semanticScholar;
      case ARXIV -> arxiv;
      case CORE -> core;
      case INTERNAL -> internal;
    };
  }

  public String getContactEmail() {
    return contactEmail;
  }

  public void setContactEmail(String contactEmail) {
    this.contactEmail = contactEmail;
  }

  public Vendor getOpenalex() {
    return openalex;
  }

  public void setOpenalex(Vendor openalex) {
    this.openalex = openalex;
  }

  public Vendor getCrossref() {
    return crossref;
  }

  public void setCrossref(Vendor crossref) {
    this.crossref = crossref;
  }

  public Vendor getSemanticScholar() {
    return semanticScholar;
  }

  public void setSemanticScholar(Vendor semanticScholar) {
    this.semanticScholar = semanticScholar;
  }

  public Vendor getArxiv() {
    return arxiv;
  }

  public void setArxiv(Vendor arxiv) {
    this.arxiv = arxiv;
  }

  public Vendor getCore() {
    return core;
  }

  public void setCore(Vendor core) {
    this.core = core;
  }

  public Vendor getInternal() {
    return internal;
  }

  public void setInternal(Vendor internal) {
    this.internal = internal;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Breaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public void setCircuitBreaker(Breaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
  }

  /** Connection and throttling settings for one vendor. */
  public static class Vendor {

    private boolean enabled = true;
    private String baseUrl;
    private @Nullable String apiKey;
    private Duration minInterval = Duration.ofMillis(1000);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(12);

    public Vendor() {
      this("");
    }

    Vendor(String baseUrl) {
      this(baseUrl, true);
    }

    Vendor(String baseUrl, boolean enabled) {
      this.baseUrl = baseUrl;
      this.enabled = enabled;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public @Nullable String getApiKey() {
      return apiKey;
    }

    public void setApiKey(@Nullable String apiKey) {
      this.apiKey = apiKey;
    }

    public Duration getMinInterval() {
      return minInterval;
    }

    public void setMinInterval(Duration minInterval) {
      this.minInterval = minInterval;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }
  }

  /**
   * Retry policy for 429 and 5xx responses. {@code max-attempts} counts the first call, so the
   * default of 4 means up to 3 retries. Fast mode uses the shorter {@code fast-*} intervals.
   */
  public static class Retry {

    private int maxAttempts = 4;
    private Duration initialInterval = Duration.ofMillis(1000);
    private double multiplier = 2.0;
    private Duration maxInterval = Duration.ofSeconds(10);
    private Duration fastInitialInterval = Duration.ofMillis(200);
    private Duration fastMaxInterval = Duration.ofSeconds(2);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialInterval() {
      return initialInterval;
    }

    public void setInitialInterval(Duration initialInterval) {
      this.initialInterval = initialInterval;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxInterval() {
      return maxInterval;
    }

    public void setMaxInterval(Duration maxInterval) {
      this.maxInterval = maxInterval;
    }

    public Duration getFastInitialInterval() {
      return fastInitialInterval;
    }

    public void setFastInitialInterval(Duration fastInitialInterval) {
      this.fastInitialInterval = fastInitialInterval;
    }

    public Duration getFastMaxInterval() {
      return fastMaxInterval;
    }

    public void setFastMaxInterval(Duration fastMaxInterval) {
      this.fastMaxInterval = fastMaxInterval;
    }
  }

  /** Consecutive-failure threshold and cooldown of the per-source circuit breaker. */
  public static class Breaker {

    private int failureThreshold = 3;
    private Duration cooldown = Duration.ofSeconds(60);

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }
  }
}
