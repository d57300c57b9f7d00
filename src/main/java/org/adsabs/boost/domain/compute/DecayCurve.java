package org.adsabs.boost.domain.compute;

import java.util.Locale;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Shape of the recency decay before normalization. Every curve is non-increasing in age and
 * equals 1 at age zero.
 *
 * @since 0.1.0
 */
public enum DecayCurve {
  /** {@code 1 / (1 + k * age)}. */
  RECIPROCAL {
    @Override
    double raw(double ageMonths, double multiplier, double cutoffMonths) {
      return 1.0 / (1.0 + multiplier * ageMonths);
    }
  },
  /** {@code exp(-k * age)}. */
  EXPONENTIAL {
    @Override
    double raw(double ageMonths, double multiplier, double cutoffMonths) {
      return Math.exp(-multiplier * ageMonths);
    }
  },
  /** Straight line reaching zero at the cutoff. */
  LINEAR {
    @Override
    double raw(double ageMonths, double multiplier, double cutoffMonths) {
      return Math.max(0.0, 1.0 - ageMonths / cutoffMonths);
    }
  };

  abstract double raw(double ageMonths, double multiplier, double cutoffMonths);

  /**
   * Parses a curve name.
   *
   * @param value name, case-insensitive
   * @return curve
   * @throws ConfigurationException for unknown names
   */
  public static DecayCurve parse(String value) {
    if (value == null || value.isBlank()) {
      return RECIPROCAL;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("unknown recency curve: " + value, ex);
    }
  }
}
