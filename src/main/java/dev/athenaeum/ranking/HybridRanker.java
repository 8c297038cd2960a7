package dev.athenaeum.ranking;

import dev.athenaeum.paper.RawResult;
import dev.athenaeum.paper.ScoredResult;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores and orders raw results by a weighted combination of four signals:
 *
 * <ul>
 *   <li>semantic: cosine similarity between query and title+abstract embeddings, clamped to [0, 1]
 *   <li>keyword: batch-normalised BM25 ({@link KeywordScorer})
 *   <li>authority: {@code min(1, log10(citations + 1) / log10(saturation + 1))}
 *   <li>recency: {@code clamp(1 - age / horizon)}, a fixed floor for undated papers
 * </ul>
 *
 * <p>Ordering is total and deterministic: combined score desc, citation count desc, year desc,
 * canonical id asc. The embedding model is skipped entirely when the semantic weight is zero; if it
 * fails, semantic scores fall back to zero and ranking continues on the other signals.
 */
@Service
public class HybridRanker {

  private static final Logger log = LoggerFactory.getLogger(HybridRanker.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to the
   * query only, not to the paper text.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  static final Comparator<ScoredResult> RANKING_ORDER =
      Comparator.comparingDouble(ScoredResult::combinedScore)
          .reversed()
          .thenComparing(
              (ScoredResult r) -> r.raw().citationsOrZero(), Comparator.reverseOrder())
          .thenComparing(
              (ScoredResult r) -> r.raw().year(),
              Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
          .thenComparing(ScoredResult::canonicalId);

  private final EmbeddingModel embeddingModel;
  private final RankingProperties properties;
  private final Clock clock;

  public HybridRanker(EmbeddingModel embeddingModel, RankingProperties properties, Clock clock) {
    this.embeddingModel = embeddingModel;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Scores every result and returns them best first.
   *
   * @param query the research query
   * @param results raw results from all sources
   * @param weights signal weights
   * @return scored results in ranking order, same size as the input
   */
  public List<ScoredResult> rank(String query, List<RawResult> results, RankingWeights weights) {
    if (results.isEmpty()) {
      return List.of();
    }
    double[] semantic = semanticScores(query, results, weights.semantic());
    double[] keyword =
        KeywordScorer.score(
            query,
            results,
            properties.getBm25K1(),
            properties.getBm25B(),
            properties.getTitleWeight());
    int currentYear = Year.now(clock).getValue();

    List<ScoredResult> scored = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      RawResult raw = results.get(i);
      double authority = authorityScore(raw.citationCount());
      double recency = recencyScore(raw.year(), currentYear);
      double combined =
          weights.semantic() * semantic[i]
              + weights.authority() * authority
              + weights.recency() * recency
              + weights.keyword() * keyword[i];
      scored.add(new ScoredResult(raw, semantic[i], keyword[i], authority, recency, clamp(combined)));
    }
    scored.sort(RANKING_ORDER);
    return scored;
  }

  double authorityScore(@Nullable Integer citationCount) {
    if (citationCount == null || citationCount <= 0) {
      return 0.0;
    }
    double saturation = Math.log10(properties.getCitationSaturation() + 1.0);
    return clamp(Math.log10(citationCount + 1.0) / saturation);
  }

  double recencyScore(@Nullable Integer year, int currentYear) {
    if (year == null) {
      return properties.getUndatedRecency();
    }
    int age = Math.max(0, currentYear - year);
    return clamp(1.0 - (double) age / properties.getRecencyHorizonYears());
  }

  private double[] semanticScores(String query, List<RawResult> results, double weight) {
    double[] scores = new double[results.size()];
    if (weight <= 0.0) {
      return scores;
    }
    try {
      Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query).content();
      List<TextSegment> segments =
          results.stream().map(r -> TextSegment.from(embeddingText(r))).toList();
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      for (int i = 0; i < scores.length && i < embeddings.size(); i++) {
        scores[i] = clamp(CosineSimilarity.between(queryEmbedding, embeddings.get(i)));
      }
    } catch (RuntimeException e) {
      log.warn("Embedding model failed, semantic scores set to 0: {}", e.getMessage());
      return new double[results.size()];
    }
    return scores;
  }

  private static String embeddingText(RawResult raw) {
    return raw.abstractText() == null ? raw.title() : raw.title() + "\n" + raw.abstractText();
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
