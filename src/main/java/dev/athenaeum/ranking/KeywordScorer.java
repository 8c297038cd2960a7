package dev.athenaeum.ranking;

import dev.athenaeum.paper.PaperNormalizer;
import dev.athenaeum.paper.RawResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Pure static BM25 scoring of a batch of papers against a query.
 *
 * <p>Each paper is one document made of its title and abstract, with title terms counted {@code
 * titleWeight} times. IDF uses the {@code ln(1 + (N - df + 0.5) / (df + 0.5))} form, which stays
 * positive even for terms present in every document. Scores are divided by the batch maximum, so
 * the best paper scores 1.0 and a batch without any query term scores 0.0 throughout.
 */
public final class KeywordScorer {

  private KeywordScorer() {}

  /**
   * Scores every paper of the batch.
   *
   * @param query research query
   * @param papers the batch, which is also the IDF corpus
   * @param k1 term-frequency saturation
   * @param b length normalisation
   * @param titleWeight multiplier for title term occurrences
   * @return normalised scores in [0, 1], index-aligned with {@code papers}
   */
  public static double[] score(
      String query, List<RawResult> papers, double k1, double b, double titleWeight) {
    double[] scores = new double[papers.size()];
    Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
    if (papers.isEmpty() || queryTerms.isEmpty()) {
      return scores;
    }

    int n = papers.size();
    double[] lengths = new double[n];
    List<Map<String, Double>> frequencies = new ArrayList<>(n);
    Map<String, Integer> documentFrequency = new HashMap<>();
    double totalLength = 0.0;

    for (int i = 0; i < n; i++) {
      RawResult paper = papers.get(i);
      Map<String, Double> tf = new HashMap<>();
      List<String> titleTokens = tokenize(paper.title());
      List<String> abstractTokens = tokenize(paper.abstractText());
      for (String token : titleTokens) {
        tf.merge(token, titleWeight, Double::sum);
      }
      for (String token : abstractTokens) {
        tf.merge(token, 1.0, Double::sum);
      }
      lengths[i] = titleWeight * titleTokens.size() + abstractTokens.size();
      totalLength += lengths[i];
      frequencies.add(tf);
      for (String term : queryTerms) {
        if (tf.containsKey(term)) {
          documentFrequency.merge(term, 1, Integer::sum);
        }
      }
    }

    double averageLength = totalLength / n;
    double max = 0.0;
    for (int i = 0; i < n; i++) {
      double score = 0.0;
      for (String term : queryTerms) {
        Double tf = frequencies.get(i).get(term);
        if (tf == null) {
          continue;
        }
        int df = documentFrequency.getOrDefault(term, 0);
        double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
        double lengthRatio = averageLength > 0 ? lengths[i] / averageLength : 0.0;
        score += idf * (tf * (k1 + 1.0)) / (tf + k1 * (1.0 - b + b * lengthRatio));
      }
      scores[i] = score;
      max = Math.max(max, score);
    }

    if (max > 0.0) {
      for (int i = 0; i < n; i++) {
        scores[i] = Math.min(1.0, scores[i] / max);
      }
    }
    return scores;
  }

  static List<String> tokenize(@Nullable String text) {
    String normalized = PaperNormalizer.normalizeTitle(text);
    if (normalized.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(normalized.split(" "));
  }
}
