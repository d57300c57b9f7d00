package org.adsabs.boost.domain.compute;

import org.adsabs.boost.domain.DisciplineScores;

/**
 * Scales the combined boost by each discipline weight.
 *
 * @since 0.1.0
 */
public final class FinalBoostAggregator {
  private FinalBoostAggregator() {}

  /**
   * Computes {@code combined * weight} per discipline.
   *
   * @param weights discipline weights in [0, 1]
   * @param combinedBoost combined boost in [0, 1]
   * @return final boosts, each in [0, 1]
   */
  public static DisciplineScores aggregate(DisciplineScores weights, double combinedBoost) {
    if (!(combinedBoost >= 0.0 && combinedBoost <= 1.0)) {
      throw new IllegalArgumentException("combined boost must be within [0, 1]: " + combinedBoost);
    }
    return weights.map(weight -> Math.min(1.0, Math.max(0.0, combinedBoost * weight)));
  }
}
