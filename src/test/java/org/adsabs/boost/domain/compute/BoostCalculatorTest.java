package org.adsabs.boost.domain.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class BoostCalculatorTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

  private final List<String> unknown = new ArrayList<>();
  private final RankingTable ranking = new RankingTable(
      Map.of("article", 1, "inproceedings", 2, "abstract", 3),
      Map.of("physics", Map.of(Discipline.PHYSICS, 1.0)));

  private BoostCalculator calculator(BoostWeights weights) {
    return new BoostCalculator(
        ranking, DoctypeScale.evenlySpaced(List.of(1, 2, 3)), 0.05, RecencyDecay.defaults(), weights, unknown::add);
  }

  private static BoostRequest request(boolean refereed, String docType, LocalDate published) {
    return new BoostRequest("2024PhRvD.109a0001A", null, refereed, docType, published, Set.of("physics"));
  }

  @Test
  void refereedBoostFollowsFlag() {
    BoostCalculator calculator = calculator(BoostWeights.defaults());

    assertEquals(1.0, calculator.basicBoosts(request(true, "article", TODAY), TODAY).refereed());
    assertEquals(0.0, calculator.basicBoosts(request(false, "article", TODAY), TODAY).refereed());
  }

  @Test
  void doctypeTiersMapOntoScale() {
    BoostCalculator calculator = calculator(BoostWeights.defaults());

    assertEquals(1.0, calculator.basicBoosts(request(true, "article", TODAY), TODAY).doctype(), 1e-12);
    assertEquals(0.5, calculator.basicBoosts(request(true, "inproceedings", TODAY), TODAY).doctype(), 1e-12);
    assertEquals(0.0, calculator.basicBoosts(request(true, "abstract", TODAY), TODAY).doctype(), 1e-12);
    assertTrue(unknown.isEmpty());
  }

  @Test
  void unknownDoctypeUsesConfiguredBoostAndIsReported() {
    BasicBoosts boosts = calculator(BoostWeights.defaults()).basicBoosts(request(false, "newsletter", null), TODAY);

    assertEquals(0.05, boosts.doctype(), 1e-12);
    assertEquals(0.0, boosts.recency(), 1e-12);
    assertEquals(List.of("newsletter"), unknown);
  }

  @Test
  void weightsAreNormalized() {
    BasicBoosts boosts = new BasicBoosts(1.0, 0.5, 0.0);

    assertEquals(0.4 * 1.0 + 0.6 * 0.5, calculator(BoostWeights.defaults()).combinedBoost(boosts), 1e-12);
    assertEquals(0.4 * 1.0 + 0.6 * 0.5, calculator(new BoostWeights(4, 6, 0)).combinedBoost(boosts), 1e-12);
    assertEquals(0.5, calculator(new BoostWeights(0, 0, 0)).combinedBoost(boosts), 1e-12);
  }

  @Test
  void combinedBoostStaysWithinBasicBoosts() {
    BoostCalculator calculator = calculator(new BoostWeights(0.2, 0.3, 0.5));
    BasicBoosts boosts = calculator.basicBoosts(request(true, "inproceedings", TODAY.minusMonths(6)), TODAY);
    double combined = calculator.combinedBoost(boosts);

    double low = Math.min(boosts.refereed(), Math.min(boosts.doctype(), boosts.recency()));
    double high = Math.max(boosts.refereed(), Math.max(boosts.doctype(), boosts.recency()));
    assertTrue(combined >= low && combined <= high);
  }

  @Test
  void rejectsScaleMissingATier() {
    assertThrows(ConfigurationException.class, () -> new BoostCalculator(
        ranking, DoctypeScale.explicit(Map.of(1, 1.0, 2, 0.5)), 0.0,
        RecencyDecay.defaults(), BoostWeights.defaults(), unknown::add));
  }

  @Test
  void rejectsNegativeWeightsAndIncreasingScale() {
    assertThrows(ConfigurationException.class, () -> new BoostWeights(-0.1, 0.6, 0.5));
    assertThrows(ConfigurationException.class, () -> DoctypeScale.explicit(Map.of(1, 0.4, 2, 0.9)));
    assertThrows(ConfigurationException.class, () -> DoctypeScale.explicit(Map.of(1, 1.2)));
  }
}
