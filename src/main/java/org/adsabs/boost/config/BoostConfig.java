package org.adsabs.boost.config;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.compute.BoostCalculator;
import org.adsabs.boost.domain.compute.BoostComputation;
import org.adsabs.boost.domain.compute.BoostWeights;
import org.adsabs.boost.domain.compute.DecayCurve;
import org.adsabs.boost.domain.compute.DisciplineWeightResolver;
import org.adsabs.boost.domain.compute.DoctypeScale;
import org.adsabs.boost.domain.compute.RankingTable;
import org.adsabs.boost.domain.compute.RecencyDecay;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.adsabs.boost.validation.Numbers;

/**
 * <strong>What:</strong> Immutable scoring configuration: ranking tables, doctype scale, recency
 * decay and combination weights.
 * <p><strong>Why:</strong> Built and validated once at startup, then passed explicitly to the
 * computation; invalid tables fail the process before any record is scored.</p>
 *
 * @param ranking ranking tables
 * @param doctypeScale boost per doctype tier
 * @param unknownDoctypeBoost boost for unranked document types
 * @param recency recency decay
 * @param weights combination weights
 * @param defaultDisciplineWeight weight of disciplines no collection maps to
 * @param fallbackCollection collection assumed for records without collections; {@code null}
 *     disables
 * @since 0.1.0
 */
public record BoostConfig(
    RankingTable ranking,
    DoctypeScale doctypeScale,
    double unknownDoctypeBoost,
    RecencyDecay recency,
    BoostWeights weights,
    double defaultDisciplineWeight,
    String fallbackCollection) {

  public BoostConfig {
    Objects.requireNonNull(ranking, "ranking");
    Objects.requireNonNull(doctypeScale, "doctypeScale");
    Objects.requireNonNull(recency, "recency");
    Objects.requireNonNull(weights, "weights");
  }

  /** Built-in tables with default weights and decay. */
  public static BoostConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Reads the scoring configuration from flattened keys; see {@code boost.yaml} for the layout.
   *
   * @param config effective configuration
   * @return validated configuration
   * @throws ConfigurationException if any value is invalid
   */
  public static BoostConfig fromMap(Map<String, String> config) {
    Map<String, Integer> doctypes = intSection(config, "ranking.doctypes.");
    if (doctypes.isEmpty()) {
      doctypes = RankingDefaults.doctypes();
    }
    Map<String, Map<String, Integer>> collectionRanks = nestedIntSection(config, "ranking.collections.");
    Map<String, Map<String, Double>> collectionWeights = nestedDoubleSection(config, "ranking.collectionWeights.");
    RankingTable ranking;
    if (!collectionWeights.isEmpty()) {
      if (!collectionRanks.isEmpty()) {
        throw new ConfigurationException("configure ranking.collections or ranking.collectionWeights, not both");
      }
      ranking = new RankingTable(doctypes, resolveDisciplines(collectionWeights));
    } else {
      ranking = RankingTable.fromRanks(
          doctypes, collectionRanks.isEmpty() ? RankingDefaults.collections() : collectionRanks);
    }

    Map<String, Double> tierBoostText = doubleSection(config, "ranking.doctypeTierBoosts.");
    DoctypeScale scale;
    if (tierBoostText.isEmpty()) {
      scale = DoctypeScale.evenlySpaced(ranking.doctypeTiers().values());
    } else {
      Map<Integer, Double> tierBoosts = new LinkedHashMap<>();
      tierBoostText.forEach((tier, boost) -> tierBoosts.put(
          Numbers.parseInt("ranking.doctypeTierBoosts." + tier, tier, 0, 1, Integer.MAX_VALUE), boost));
      scale = DoctypeScale.explicit(tierBoosts);
    }

    RecencyDecay decayDefaults = RecencyDecay.defaults();
    RecencyDecay recency = new RecencyDecay(
        DecayCurve.parse(config.get("recency.curve")),
        Numbers.parseDouble("recency.multiplier", config.get("recency.multiplier"), decayDefaults.multiplier()),
        Numbers.parseDouble("recency.cutoffMonths", config.get("recency.cutoffMonths"), decayDefaults.cutoffMonths()),
        Numbers.parseDouble("recency.floor", config.get("recency.floor"), decayDefaults.floor()),
        Numbers.parseDouble("recency.max", config.get("recency.max"), decayDefaults.max()));

    BoostWeights weightDefaults = BoostWeights.defaults();
    BoostWeights weights = new BoostWeights(
        Numbers.parseDouble("boost.weights.refereed", config.get("boost.weights.refereed"), weightDefaults.refereed()),
        Numbers.parseDouble("boost.weights.doctype", config.get("boost.weights.doctype"), weightDefaults.doctype()),
        Numbers.parseDouble("boost.weights.recency", config.get("boost.weights.recency"), weightDefaults.recency()));

    String fallback = config.getOrDefault("ranking.fallbackCollection", "general");
    return new BoostConfig(
        ranking,
        scale,
        Numbers.parseDouble("ranking.unknownDoctypeBoost", config.get("ranking.unknownDoctypeBoost"), 0.0),
        recency,
        weights,
        Numbers.parseDouble("ranking.defaultDisciplineWeight", config.get("ranking.defaultDisciplineWeight"), 0.0),
        fallback == null || fallback.isBlank() ? null : fallback.trim());
  }

  /**
   * Builds the computation, validating cross-table consistency.
   *
   * @param unknownDoctypeObserver notified of unranked document types
   * @return computation
   * @throws ConfigurationException if the tables are inconsistent
   */
  public BoostComputation newComputation(Consumer<String> unknownDoctypeObserver) {
    BoostCalculator calculator = new BoostCalculator(
        ranking, doctypeScale, unknownDoctypeBoost, recency, weights, unknownDoctypeObserver);
    DisciplineWeightResolver resolver =
        new DisciplineWeightResolver(ranking, defaultDisciplineWeight, fallbackCollection);
    return new BoostComputation(calculator, resolver);
  }

  private static Map<String, Integer> intSection(Map<String, String> config, String prefix) {
    Map<String, Integer> section = new LinkedHashMap<>();
    config.forEach((key, value) -> {
      if (key.startsWith(prefix) && key.indexOf('.', prefix.length()) < 0) {
        section.put(key.substring(prefix.length()), Numbers.parseInt(key, value, 0, 1, Integer.MAX_VALUE));
      }
    });
    return section;
  }

  private static Map<String, Double> doubleSection(Map<String, String> config, String prefix) {
    Map<String, Double> section = new LinkedHashMap<>();
    config.forEach((key, value) -> {
      if (key.startsWith(prefix) && key.indexOf('.', prefix.length()) < 0) {
        section.put(key.substring(prefix.length()), Numbers.parseDouble(key, value, Double.NaN));
      }
    });
    return section;
  }

  private static Map<String, Map<String, Integer>> nestedIntSection(Map<String, String> config, String prefix) {
    Map<String, Map<String, Integer>> section = new LinkedHashMap<>();
    config.forEach((key, value) -> {
      String[] parts = splitNested(key, prefix);
      if (parts != null) {
        section.computeIfAbsent(parts[0], k -> new LinkedHashMap<>())
            .put(parts[1], Numbers.parseInt(key, value, 0, 1, Integer.MAX_VALUE));
      }
    });
    return section;
  }

  private static Map<String, Map<String, Double>> nestedDoubleSection(Map<String, String> config, String prefix) {
    Map<String, Map<String, Double>> section = new LinkedHashMap<>();
    config.forEach((key, value) -> {
      String[] parts = splitNested(key, prefix);
      if (parts != null) {
        section.computeIfAbsent(parts[0], k -> new LinkedHashMap<>())
            .put(parts[1], Numbers.parseDouble(key, value, Double.NaN));
      }
    });
    return section;
  }

  private static String[] splitNested(String key, String prefix) {
    if (!key.startsWith(prefix)) {
      return null;
    }
    String rest = key.substring(prefix.length());
    int dot = rest.indexOf('.');
    if (dot <= 0 || dot == rest.length() - 1 || rest.indexOf('.', dot + 1) >= 0) {
      throw new ConfigurationException("expected " + prefix + "<collection>.<discipline> but found " + key);
    }
    return new String[] {rest.substring(0, dot), rest.substring(dot + 1)};
  }

  private static Map<String, Map<Discipline, Double>> resolveDisciplines(Map<String, Map<String, Double>> raw) {
    Map<String, Map<Discipline, Double>> resolved = new LinkedHashMap<>();
    raw.forEach((collection, row) -> {
      Map<Discipline, Double> mapped = new EnumMap<>(Discipline.class);
      row.forEach((tag, weight) -> mapped.put(
          Discipline.fromTag(tag).orElseThrow(() -> new ConfigurationException(
              "unknown discipline '" + tag + "' in ranking.collectionWeights." + collection)),
          weight));
      resolved.put(collection, mapped);
    });
    return resolved;
  }
}
