package org.adsabs.boost.domain.compute;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * <strong>What:</strong> Converts a publication date into a recency boost.
 * <p><strong>Why:</strong> Newer papers are boosted; the boost falls with age and reaches the floor
 * at the cutoff, staying there for older or undated records.</p>
 * <p>The raw curve value {@code d(age)} is rescaled so that age zero yields {@code max} and the
 * cutoff yields {@code floor}:
 * {@code floor + (max - floor) * (d(age) - d(cutoff)) / (d(0) - d(cutoff))}. Dates in the future are
 * treated as age zero.</p>
 *
 * @param curve decay shape
 * @param multiplier curve steepness
 * @param cutoffMonths age at which the floor is reached
 * @param floor boost at and beyond the cutoff
 * @param max boost at age zero
 * @since 0.1.0
 */
public record RecencyDecay(
    DecayCurve curve, double multiplier, double cutoffMonths, double floor, double max) {
  /** Average month length used to convert days to months. */
  public static final double DAYS_PER_MONTH = 30.44;

  private static final double EPSILON = 1e-12;

  public RecencyDecay {
    Objects.requireNonNull(curve, "curve");
    if (!(multiplier >= 0.0) || !Double.isFinite(multiplier)) {
      throw new ConfigurationException("recency multiplier must be >= 0: " + multiplier);
    }
    if (!(cutoffMonths > 0.0) || !Double.isFinite(cutoffMonths)) {
      throw new ConfigurationException("recency cutoff must be > 0 months: " + cutoffMonths);
    }
    if (!(floor >= 0.0 && floor <= max && max <= 1.0)) {
      throw new ConfigurationException(
          "recency bounds must satisfy 0 <= floor <= max <= 1: floor=" + floor + " max=" + max);
    }
  }

  /** Reciprocal decay, multiplier 0.1, cutoff 24 months, floor 0, max 1. */
  public static RecencyDecay defaults() {
    return new RecencyDecay(DecayCurve.RECIPROCAL, 0.1, 24.0, 0.0, 1.0);
  }

  /**
   * Computes the boost for a publication date.
   *
   * @param publicationDate date, or {@code null} when unknown
   * @param today reference date
   * @return boost in [floor, max]
   */
  public double boostFor(LocalDate publicationDate, LocalDate today) {
    if (publicationDate == null) {
      return floor;
    }
    long days = ChronoUnit.DAYS.between(publicationDate, Objects.requireNonNull(today, "today"));
    return boostForAge(Math.max(0L, days) / DAYS_PER_MONTH);
  }

  /**
   * Computes the boost for an age in months.
   *
   * @param ageMonths non-negative age
   * @return boost in [floor, max]
   */
  public double boostForAge(double ageMonths) {
    double age = Math.max(0.0, ageMonths);
    if (age >= cutoffMonths) {
      return floor;
    }
    double atZero = curve.raw(0.0, multiplier, cutoffMonths);
    double atCutoff = curve.raw(cutoffMonths, multiplier, cutoffMonths);
    double span = atZero - atCutoff;
    double normalized = span > EPSILON
        ? (curve.raw(age, multiplier, cutoffMonths) - atCutoff) / span
        : 1.0 - age / cutoffMonths;
    double clamped = Math.min(1.0, Math.max(0.0, normalized));
    return floor + (max - floor) * clamped;
  }
}
