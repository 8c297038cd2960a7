package dev.athenaeum.paper;

/**
 * A {@link RawResult} with its ranking signals. Every score is in [0, 1].
 *
 * @param raw the underlying source record
 * @param semanticScore cosine similarity between query and title+abstract embeddings
 * @param keywordScore batch-normalised BM25 score
 * @param authorityScore log-scaled citation count
 * @param recencyScore linear decay of publication age
 * @param combinedScore weighted sum of the four signals
 */
public record ScoredResult(
    RawResult raw,
    double semanticScore,
    double keywordScore,
    double authorityScore,
    double recencyScore,
    double combinedScore) {

  public ScoredResult {
    if (raw == null) {
      throw new IllegalArgumentException("raw must not be null");
    }
    requireUnit("semanticScore", semanticScore);
    requireUnit("keywordScore", keywordScore);
    requireUnit("authorityScore", authorityScore);
    requireUnit("recencyScore", recencyScore);
    requireUnit("combinedScore", combinedScore);
  }

  public String canonicalId() {
    return raw.canonicalId();
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
    }
  }
}
