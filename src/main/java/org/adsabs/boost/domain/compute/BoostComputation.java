package org.adsabs.boost.domain.compute;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.DisciplineScores;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.domain.error.ValidationException;

/**
 * Runs the full computation for one record: basic boosts, combined boost, discipline weights and
 * final boosts.
 *
 * @since 0.1.0
 */
public final class BoostComputation {
  private final BoostCalculator calculator;
  private final DisciplineWeightResolver resolver;

  public BoostComputation(BoostCalculator calculator, DisciplineWeightResolver resolver) {
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /**
   * Computes boost factors.
   *
   * @param request record to score
   * @param now computation time; recency is measured against its UTC date
   * @return boost factors stamped with {@code now}
   * @throws ValidationException if the record has no identifier
   */
  public BoostFactors compute(BoostRequest request, Instant now) throws ValidationException {
    RecordKey key = request.key();
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    BasicBoosts basics = calculator.basicBoosts(request, today);
    double combined = calculator.combinedBoost(basics);
    DisciplineScores weights = resolver.resolve(request.collections());
    DisciplineScores finals = FinalBoostAggregator.aggregate(weights, combined);
    return new BoostFactors(key, basics, combined, weights, finals, now);
  }
}
