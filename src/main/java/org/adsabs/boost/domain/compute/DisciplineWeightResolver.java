package org.adsabs.boost.domain.compute;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.DisciplineScores;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Determines how relevant a record is to each discipline from its collections.
 *
 * <p>For every discipline the weight is the maximum over the record's collections that map to it;
 * disciplines no collection maps to get the default weight. Records without collections are
 * treated as belonging to the fallback collection when one is configured.</p>
 *
 * @since 0.1.0
 */
public final class DisciplineWeightResolver {
  private final RankingTable ranking;
  private final double defaultWeight;
  private final String fallbackCollection;

  /**
   * Creates a resolver.
   *
   * @param ranking ranking tables
   * @param defaultWeight weight of unmapped disciplines, in [0, 1]
   * @param fallbackCollection collection assumed for records without collections; may be
   *     {@code null}
   */
  public DisciplineWeightResolver(RankingTable ranking, double defaultWeight, String fallbackCollection) {
    this.ranking = Objects.requireNonNull(ranking, "ranking");
    if (!(defaultWeight >= 0.0 && defaultWeight <= 1.0)) {
      throw new ConfigurationException("default discipline weight must be within [0, 1]: " + defaultWeight);
    }
    this.defaultWeight = defaultWeight;
    String fallback = fallbackCollection == null ? "" : Discipline.normalizeTag(fallbackCollection);
    this.fallbackCollection = fallback.isEmpty() ? null : fallback;
  }

  public DisciplineScores resolve(Set<String> collections) {
    Set<String> effective = collections;
    if (effective.isEmpty() && fallbackCollection != null) {
      effective = Set.of(fallbackCollection);
    }
    EnumMap<Discipline, Double> best = new EnumMap<>(Discipline.class);
    for (String collection : effective) {
      for (Map.Entry<Discipline, Double> entry : ranking.collectionWeights(collection).entrySet()) {
        best.merge(entry.getKey(), entry.getValue(), Math::max);
      }
    }
    for (Discipline discipline : Discipline.values()) {
      best.putIfAbsent(discipline, defaultWeight);
    }
    return DisciplineScores.of(best);
  }
}
