package org.adsabs.boost.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable mapping from every {@link Discipline} to a score.
 *
 * <p>Used both for discipline weights and for final boosts; construction rejects maps that do not
 * cover all disciplines or contain non-finite values.</p>
 *
 * @since 0.1.0
 */
public final class DisciplineScores {
  private final EnumMap<Discipline, Double> scores;

  private DisciplineScores(EnumMap<Discipline, Double> scores) {
    this.scores = scores;
  }

  /**
   * Creates scores from a complete map.
   *
   * @param values one finite value per discipline
   * @return immutable scores
   * @throws IllegalArgumentException if a discipline is missing or a value is not finite
   */
  public static DisciplineScores of(Map<Discipline, Double> values) {
    Objects.requireNonNull(values, "values");
    EnumMap<Discipline, Double> copy = new EnumMap<>(Discipline.class);
    for (Discipline discipline : Discipline.values()) {
      Double value = values.get(discipline);
      if (value == null) {
        throw new IllegalArgumentException("missing score for " + discipline.tag());
      }
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("score for " + discipline.tag() + " must be finite");
      }
      copy.put(discipline, value);
    }
    return new DisciplineScores(copy);
  }

  /**
   * Creates scores with the same value for every discipline.
   *
   * @param value score
   * @return immutable scores
   */
  public static DisciplineScores uniform(double value) {
    EnumMap<Discipline, Double> map = new EnumMap<>(Discipline.class);
    for (Discipline discipline : Discipline.values()) {
      map.put(discipline, value);
    }
    return of(map);
  }

  public double get(Discipline discipline) {
    return scores.get(Objects.requireNonNull(discipline, "discipline"));
  }

  /**
   * Applies {@code fn} to every score.
   *
   * @param fn mapping function
   * @return new scores
   */
  public DisciplineScores map(DoubleUnaryOperator fn) {
    EnumMap<Discipline, Double> mapped = new EnumMap<>(Discipline.class);
    scores.forEach((d, v) -> mapped.put(d, fn.applyAsDouble(v)));
    return of(mapped);
  }

  /**
   * Returns a read-only view ordered by {@link Discipline} declaration order.
   *
   * @return unmodifiable map
   */
  public Map<Discipline, Double> asMap() {
    return Collections.unmodifiableMap(scores);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DisciplineScores other && scores.equals(other.scores);
  }

  @Override
  public int hashCode() {
    return scores.hashCode();
  }

  @Override
  public String toString() {
    return "DisciplineScores" + scores;
  }
}
