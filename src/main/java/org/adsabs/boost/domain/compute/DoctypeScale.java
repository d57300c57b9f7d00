package org.adsabs.boost.domain.compute;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Maps document type tiers to boosts in [0, 1]. Better tiers (lower numbers) never receive a lower
 * boost than worse tiers.
 *
 * @since 0.1.0
 */
public final class DoctypeScale {
  private final TreeMap<Integer, Double> boosts;

  private DoctypeScale(TreeMap<Integer, Double> boosts) {
    this.boosts = boosts;
  }

  /**
   * Spreads the distinct tiers evenly over [0, 1]: the best tier receives 1.0 and the worst 0.0.
   * A single tier receives 1.0.
   *
   * @param tiers tiers in use
   * @return scale covering every tier
   */
  public static DoctypeScale evenlySpaced(Collection<Integer> tiers) {
    TreeSet<Integer> distinct = new TreeSet<>(Objects.requireNonNull(tiers, "tiers"));
    TreeMap<Integer, Double> boosts = new TreeMap<>();
    int n = distinct.size();
    int i = 0;
    for (Integer tier : distinct) {
      boosts.put(tier, n == 1 ? 1.0 : 1.0 - (double) i / (n - 1));
      i++;
    }
    return new DoctypeScale(boosts);
  }

  /**
   * Uses explicitly configured boosts per tier.
   *
   * @param tierBoosts boost per tier
   * @return validated scale
   * @throws ConfigurationException if a boost lies outside [0, 1] or a worse tier has a higher
   *     boost than a better one
   */
  public static DoctypeScale explicit(Map<Integer, Double> tierBoosts) {
    TreeMap<Integer, Double> boosts = new TreeMap<>(Objects.requireNonNull(tierBoosts, "tierBoosts"));
    double previous = Double.POSITIVE_INFINITY;
    for (Map.Entry<Integer, Double> entry : boosts.entrySet()) {
      Double boost = entry.getValue();
      if (boost == null || !(boost >= 0.0 && boost <= 1.0)) {
        throw new ConfigurationException(
            "doctype boost for tier " + entry.getKey() + " must be within [0, 1]: " + boost);
      }
      if (boost > previous) {
        throw new ConfigurationException(
            "doctype boosts must not increase with tier; tier " + entry.getKey() + " has " + boost);
      }
      previous = boost;
    }
    return new DoctypeScale(boosts);
  }

  /**
   * Returns the boost for a tier.
   *
   * @param tier tier present in the scale
   * @return boost in [0, 1]
   * @throws IllegalArgumentException if the tier is not covered
   */
  public double boostFor(int tier) {
    Double boost = boosts.get(tier);
    if (boost == null) {
      throw new IllegalArgumentException("no doctype boost configured for tier " + tier);
    }
    return boost;
  }

  public boolean covers(int tier) {
    return boosts.containsKey(tier);
  }

  public Map<Integer, Double> asMap() {
    return Collections.unmodifiableMap(boosts);
  }
}
