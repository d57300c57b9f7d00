package org.adsabs.boost.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Complete result of a boost computation for one record.
 * <p><strong>Why:</strong> This is the unit that is persisted (one row per record) and published to
 * downstream consumers.</p>
 *
 * @param key record identity
 * @param basics basic boosts
 * @param combinedBoost weighted combination of the basic boosts, in [0, 1]
 * @param disciplineWeights relevance of the record to each discipline, in [0, 1]
 * @param finalBoosts {@code combinedBoost * weight} per discipline
 * @param created computation timestamp
 * @since 0.1.0
 */
public record BoostFactors(
    RecordKey key,
    BasicBoosts basics,
    double combinedBoost,
    DisciplineScores disciplineWeights,
    DisciplineScores finalBoosts,
    Instant created) {

  public BoostFactors {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(basics, "basics");
    Objects.requireNonNull(disciplineWeights, "disciplineWeights");
    Objects.requireNonNull(finalBoosts, "finalBoosts");
    Objects.requireNonNull(created, "created");
    if (!(combinedBoost >= 0.0 && combinedBoost <= 1.0)) {
      throw new IllegalArgumentException("combined boost must be within [0, 1]: " + combinedBoost);
    }
  }
}
