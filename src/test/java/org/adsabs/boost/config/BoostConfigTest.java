package org.adsabs.boost.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.compute.DecayCurve;
import org.adsabs.boost.domain.compute.RankingTable;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class BoostConfigTest {

  @Test
  void defaultsCarryTheBuiltInTables() {
    BoostConfig config = BoostConfig.defaults();

    assertEquals(1, config.ranking().doctypeTier("article").getAsInt());
    assertEquals(1.0, config.ranking().collectionWeights("astrophysics").get(Discipline.ASTRONOMY), 1e-12);
    assertEquals(1.0, config.ranking().collectionWeights("general").get(Discipline.GENERAL), 1e-12);
    assertEquals(DecayCurve.RECIPROCAL, config.recency().curve());
    assertEquals("general", config.fallbackCollection());
  }

  @Test
  void bundledYamlLoads() throws Exception {
    Path yaml = Path.of(BoostConfigTest.class.getResource("/boost.yaml").toURI());
    Map<String, String> flat = YamlConfigLoader.load(yaml, "run").orElseThrow();

    BoostConfig config = BoostConfig.fromMap(flat);

    assertEquals(1, config.ranking().doctypeTier("article").getAsInt());
    assertEquals(RankingTable.MIN_WEIGHT,
        config.ranking().collectionWeights().values().stream()
            .flatMap(row -> row.values().stream())
            .mapToDouble(Double::doubleValue)
            .min()
            .orElseThrow());
  }

  @Test
  void explicitCollectionWeightsReplaceRanks() {
    BoostConfig config = BoostConfig.fromMap(Map.of(
        "ranking.collectionWeights.astrophysics.astronomy", "0.9",
        "ranking.collectionWeights.astrophysics.physics", "0.3",
        "ranking.fallbackCollection", " "));

    Map<Discipline, Double> row = config.ranking().collectionWeights("astrophysics");
    assertEquals(Map.of(Discipline.ASTRONOMY, 0.9, Discipline.PHYSICS, 0.3), row);
    assertNull(config.fallbackCollection());
  }

  @Test
  void scalarSettingsAreParsed() {
    BoostConfig config = BoostConfig.fromMap(Map.of(
        "recency.curve", "linear",
        "recency.cutoffMonths", "12",
        "boost.weights.refereed", "2",
        "ranking.unknownDoctypeBoost", "0.05",
        "ranking.defaultDisciplineWeight", "0.1"));

    assertEquals(DecayCurve.LINEAR, config.recency().curve());
    assertEquals(12.0, config.recency().cutoffMonths(), 1e-12);
    assertEquals(2.0, config.weights().refereed(), 1e-12);
    assertEquals(0.05, config.unknownDoctypeBoost(), 1e-12);
    assertEquals(0.1, config.defaultDisciplineWeight(), 1e-12);
  }

  @Test
  void conflictingOrInvalidSettingsAreRejected() {
    assertThrows(ConfigurationException.class, () -> BoostConfig.fromMap(Map.of(
        "ranking.collections.astrophysics.astronomy", "1",
        "ranking.collectionWeights.astrophysics.astronomy", "1.0")));
    assertThrows(ConfigurationException.class,
        () -> BoostConfig.fromMap(Map.of("ranking.collectionWeights.astrophysics.biology", "0.5")));
    assertThrows(ConfigurationException.class,
        () -> BoostConfig.fromMap(Map.of("recency.max", "abc")));
    assertThrows(ConfigurationException.class,
        () -> BoostConfig.fromMap(Map.of("ranking.collections.astrophysics", "1")));
    assertThrows(ConfigurationException.class,
        () -> BoostConfig.fromMap(Map.of("recency.curve", "sigmoid")));
  }
}
