package org.adsabs.boost.domain.compute;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Consumer;
import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * <strong>What:</strong> Derives basic boosts and the combined boost from a record.
 * <p><strong>Why:</strong> Pure function of the record, the ranking data and a reference date, so
 * it can run on any worker and be tested without infrastructure.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the unknown-doctype observer must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class BoostCalculator {
  private final RankingTable ranking;
  private final DoctypeScale doctypeScale;
  private final double unknownDoctypeBoost;
  private final RecencyDecay recency;
  private final BoostWeights weights;
  private final Consumer<String> unknownDoctypeObserver;

  /**
   * Creates a calculator.
   *
   * @param ranking ranking tables
   * @param doctypeScale boost per doctype tier; must cover every tier of {@code ranking}
   * @param unknownDoctypeBoost boost for document types absent from {@code ranking}
   * @param recency recency decay
   * @param weights combination weights
   * @param unknownDoctypeObserver notified with the document type whenever it is not ranked
   * @throws ConfigurationException if the scale misses a tier or the unknown boost is out of range
   */
  public BoostCalculator(
      RankingTable ranking,
      DoctypeScale doctypeScale,
      double unknownDoctypeBoost,
      RecencyDecay recency,
      BoostWeights weights,
      Consumer<String> unknownDoctypeObserver) {
    this.ranking = Objects.requireNonNull(ranking, "ranking");
    this.doctypeScale = Objects.requireNonNull(doctypeScale, "doctypeScale");
    this.recency = Objects.requireNonNull(recency, "recency");
    this.weights = Objects.requireNonNull(weights, "weights");
    this.unknownDoctypeObserver = Objects.requireNonNull(unknownDoctypeObserver, "unknownDoctypeObserver");
    if (!(unknownDoctypeBoost >= 0.0 && unknownDoctypeBoost <= 1.0)) {
      throw new ConfigurationException("unknown doctype boost must be within [0, 1]: " + unknownDoctypeBoost);
    }
    this.unknownDoctypeBoost = unknownDoctypeBoost;
    ranking.doctypeTiers().forEach((doctype, tier) -> {
      if (!doctypeScale.covers(tier)) {
        throw new ConfigurationException("no doctype boost for tier " + tier + " (" + doctype + ")");
      }
    });
  }

  /**
   * Computes the basic boosts.
   *
   * @param request record
   * @param today reference date for recency
   * @return boosts, each in [0, 1]
   */
  public BasicBoosts basicBoosts(BoostRequest request, LocalDate today) {
    double refereed = request.refereed() ? 1.0 : 0.0;
    return new BasicBoosts(refereed, doctypeBoost(request.docType()), recency.boostFor(request.publicationDate(), today));
  }

  /**
   * Combines basic boosts with the configured weights.
   *
   * @param boosts basic boosts
   * @return combined boost in [0, 1]
   */
  public double combinedBoost(BasicBoosts boosts) {
    return weights.combine(boosts);
  }

  double doctypeBoost(String docType) {
    OptionalInt tier = ranking.doctypeTier(docType);
    if (tier.isEmpty()) {
      unknownDoctypeObserver.accept(docType);
      return unknownDoctypeBoost;
    }
    return doctypeScale.boostFor(tier.getAsInt());
  }
}
