package org.adsabs.boost.domain.compute;

import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Relative weights of the basic boosts in the combined boost. Weights are normalized by their sum;
 * when every weight is zero the combined boost is the plain average.
 *
 * @param refereed weight of the refereed boost
 * @param doctype weight of the doctype boost
 * @param recency weight of the recency boost
 * @since 0.1.0
 */
public record BoostWeights(double refereed, double doctype, double recency) {
  public BoostWeights {
    requireWeight("refereed", refereed);
    requireWeight("doctype", doctype);
    requireWeight("recency", recency);
  }

  /** Refereed 0.4, doctype 0.6, recency 0.0. */
  public static BoostWeights defaults() {
    return new BoostWeights(0.4, 0.6, 0.0);
  }

  /**
   * Combines basic boosts into one value in [0, 1].
   *
   * @param boosts basic boosts
   * @return normalized weighted average
   */
  public double combine(BasicBoosts boosts) {
    double total = refereed + doctype + recency;
    if (total == 0.0) {
      return (boosts.refereed() + boosts.doctype() + boosts.recency()) / 3.0;
    }
    double combined = (refereed * boosts.refereed()
        + doctype * boosts.doctype()
        + recency * boosts.recency()) / total;
    return Math.min(1.0, Math.max(0.0, combined));
  }

  private static void requireWeight(String name, double value) {
    if (!(value >= 0.0) || !Double.isFinite(value)) {
      throw new ConfigurationException(name + " weight must be a finite value >= 0: " + value);
    }
  }
}
