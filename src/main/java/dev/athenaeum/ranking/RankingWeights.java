package dev.athenaeum.ranking;

/**
 * Weights of the ranking signals. The keyword weight is the remainder {@code 1 - semantic -
 * authority - recency}.
 *
 * @param semantic weight of embedding similarity, in [0, 1]
 * @param authority weight of citation authority, in [0, 1]
 * @param recency weight of publication recency, in [0, 1]
 */
public record RankingWeights(double semantic, double authority, double recency) {

  /** Tolerance for floating-point sums such as 0.1 + 0.2 + 0.7. */
  private static final double EPSILON = 1e-9;

  public static final RankingWeights DEFAULT = new RankingWeights(0.4, 0.2, 0.1);

  public RankingWeights {
    requireUnit("semantic", semantic);
    requireUnit("authority", authority);
    requireUnit("recency", recency);
    if (semantic + authority + recency > 1.0 + EPSILON) {
      throw new IllegalArgumentException(
          "semantic + authority + recency weights must not exceed 1.0, got: "
              + (semantic + authority + recency));
    }
  }

  public double keyword() {
    return Math.max(0.0, 1.0 - semantic - authority - recency);
  }

  private static void requireUnit(String name, double weight) {
    if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
      throw new IllegalArgumentException(name + " weight must be in [0.0, 1.0], got: " + weight);
    }
  }
}
