package org.adsabs.boost.domain;

/**
 * Per-record boosts derived from refereed status, document type and age. Each lies in [0, 1].
 *
 * @param refereed 1.0 when refereed, otherwise 0.0
 * @param doctype document type boost
 * @param recency recency boost
 * @since 0.1.0
 */
public record BasicBoosts(double refereed, double doctype, double recency) {
  public BasicBoosts {
    requireUnit("refereed", refereed);
    requireUnit("doctype", doctype);
    requireUnit("recency", recency);
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " boost must be within [0, 1]: " + value);
    }
  }
}
