package dev.athenaeum.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tuning of the hybrid ranker, bound from {@code athenaeum.ranking.*}.
 *
 * <ul>
 *   <li>{@code bm25-k1} - BM25 term-frequency saturation (default 1.2)
 *   <li>{@code bm25-b} - BM25 length normalisation (default 0.75)
 *   <li>{@code title-weight} - how many times a title occurrence counts (default 2)
 *   <li>{@code citation-saturation} - citation count that scores full authority (default 10000)
 *   <li>{@code recency-horizon-years} - age at which recency reaches zero (default 20)
 *   <li>{@code undated-recency} - recency given to papers without a year (default 0.1)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.ranking")
public class RankingProperties {

  private double bm25K1 = 1.2;
  private double bm25B = 0.75;
  private double titleWeight = 2.0;
  private int citationSaturation = 10_000;
  private int recencyHorizonYears = 20;
  private double undatedRecency = 0.1;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (bm25K1 <= 0.0) {
      throw new IllegalStateException("athenaeum.ranking.bm25-k1 must be > 0, got: " + bm25K1);
    }
    if (bm25B < 0.0 || bm25B > 1.0) {
      throw new IllegalStateException(
          "athenaeum.ranking.bm25-b must be in [0.0, 1.0], got: " + bm25B);
    }
    if (titleWeight < 1.0) {
      throw new IllegalStateException(
          "athenaeum.ranking.title-weight must be >= 1.0, got: " + titleWeight);
    }
    if (citationSaturation < 1) {
      throw new IllegalStateException(
          "athenaeum.ranking.citation-saturation must be at least 1, got: " + citationSaturation);
    }
    if (recencyHorizonYears < 1) {
      throw new IllegalStateException(
          "athenaeum.ranking.recency-horizon-years must be at least 1, got: "
              + recencyHorizonYears);
    }
    if (undatedRecency < 0.0 || undatedRecency > 1.0) {
      throw new IllegalStateException(
          "athenaeum.ranking.undated-recency must be in [0.0, 1.0], got: " + undatedRecency);
    }
  }

  public double getBm25K1() {
    return bm25K1;
  }

  public void setBm25K1(double bm25K1) {
    this.bm25K1 = bm25K1;
  }

  public double getBm25B() {
    return bm25B;
  }

  public void setBm25B(double bm25B) {
    this.bm25B = bm25B;
  }

  public double getTitleWeight() {
    return titleWeight;
  }

  public void setTitleWeight(double titleWeight) {
    this.titleWeight = titleWeight;
  }

  public int getCitationSaturation() {
    return citationSaturation;
  }

  public void setCitationSaturation(int citationSaturation) {
    this.citationSaturation = citationSaturation;
  }

  public int getRecencyHorizonYears() {
    return recencyHorizonYears;
  }

  public void setRecencyHorizonYears(int recencyHorizonYears) {
    this.recencyHorizonYears = recencyHorizonYears;
  }

  public double getUndatedRecency() {
    return undatedRecency;
  }

  public void setUndatedRecency(double undatedRecency) {
    this.undatedRecency = undatedRecency;
  }
}
