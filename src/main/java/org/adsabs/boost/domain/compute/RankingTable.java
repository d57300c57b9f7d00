package org.adsabs.boost.domain.compute;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeSet;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * <strong>What:</strong> Read-only ranking data: document type tiers and collection-to-discipline
 * weights.
 * <p><strong>Why:</strong> Keeps the tunable tables out of the calculator so they can be loaded from
 * configuration and validated once at startup.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across workers.</p>
 *
 * @since 0.1.0
 */
public final class RankingTable {
  /** Lowest weight a configured collection mapping may carry. */
  public static final double MIN_WEIGHT = 0.1;
  /** Highest weight a configured collection mapping may carry. */
  public static final double MAX_WEIGHT = 1.0;

  private final Map<String, Integer> doctypeTiers;
  private final Map<String, Map<Discipline, Double>> collectionWeights;

  /**
   * Creates a ranking table.
   *
   * @param doctypeTiers tier per document type; 1 is the best tier
   * @param collectionWeights per collection tag, the weight of each mapped discipline
   * @throws ConfigurationException if a tier is not positive or a weight lies outside
   *     [{@value #MIN_WEIGHT}, {@value #MAX_WEIGHT}]
   */
  public RankingTable(
      Map<String, Integer> doctypeTiers, Map<String, Map<Discipline, Double>> collectionWeights) {
    Objects.requireNonNull(doctypeTiers, "doctypeTiers");
    Objects.requireNonNull(collectionWeights, "collectionWeights");
    Map<String, Integer> tiers = new LinkedHashMap<>();
    doctypeTiers.forEach((doctype, tier) -> {
      if (tier == null || tier < 1) {
        throw new ConfigurationException("doctype tier must be >= 1 for " + doctype + ": " + tier);
      }
      tiers.put(doctype.trim().toLowerCase(Locale.ROOT), tier);
    });
    Map<String, Map<Discipline, Double>> weights = new LinkedHashMap<>();
    collectionWeights.forEach((tag, row) -> {
      EnumMap<Discipline, Double> copy = new EnumMap<>(Discipline.class);
      row.forEach((discipline, weight) -> {
        if (weight == null || !(weight >= MIN_WEIGHT && weight <= MAX_WEIGHT)) {
          throw new ConfigurationException(
              "collection weight for " + tag + "/" + discipline.tag() + " must be within ["
                  + MIN_WEIGHT + ", " + MAX_WEIGHT + "]: " + weight);
        }
        copy.put(discipline, weight);
      });
      String normalized = Discipline.normalizeTag(tag);
      Map<Discipline, Double> view = Collections.unmodifiableMap(copy);
      weights.put(normalized, view);
      Discipline.fromTag(normalized).ifPresent(d -> weights.putIfAbsent(d.tag(), view));
    });
    this.doctypeTiers = Collections.unmodifiableMap(tiers);
    this.collectionWeights = Collections.unmodifiableMap(weights);
  }

  /**
   * Builds a table from integer collection ranks (1 = most relevant).
   *
   * <p>The distinct ranks found anywhere in {@code collectionRanks} are sorted and spread evenly
   * over [{@value #MIN_WEIGHT}, {@value #MAX_WEIGHT}]: the best rank maps to 1.0 and the worst to
   * 0.1. Collection tags and discipline aliases are resolved through
   * {@link Discipline#fromTag(String)}.</p>
   *
   * @param doctypeTiers tier per document type
   * @param collectionRanks per collection tag, the rank of each discipline tag
   * @return ranking table
   * @throws ConfigurationException if a discipline tag is unknown or a rank is not positive
   */
  public static RankingTable fromRanks(
      Map<String, Integer> doctypeTiers, Map<String, Map<String, Integer>> collectionRanks) {
    TreeSet<Integer> distinct = new TreeSet<>();
    collectionRanks.values().forEach(row -> row.values().forEach(rank -> {
      if (rank == null || rank < 1) {
        throw new ConfigurationException("collection rank must be >= 1: " + rank);
      }
      distinct.add(rank);
    }));
    Map<Integer, Double> rankWeights = new LinkedHashMap<>();
    int n = distinct.size();
    int i = 0;
    for (Integer rank : distinct) {
      rankWeights.put(rank, spreadWeight(i, n));
      i++;
    }
    Map<String, Map<Discipline, Double>> weights = new LinkedHashMap<>();
    collectionRanks.forEach((tag, row) -> {
      EnumMap<Discipline, Double> mapped = new EnumMap<>(Discipline.class);
      row.forEach((disciplineTag, rank) -> {
        Discipline discipline = Discipline.fromTag(disciplineTag)
            .orElseThrow(() -> new ConfigurationException(
                "unknown discipline '" + disciplineTag + "' in ranking for collection " + tag));
        mapped.put(discipline, rankWeights.get(rank));
      });
      weights.put(tag, mapped);
    });
    return new RankingTable(doctypeTiers, weights);
  }

  static double spreadWeight(int index, int count) {
    if (index == 0 || count == 1) {
      return MAX_WEIGHT;
    }
    if (index == count - 1) {
      return MIN_WEIGHT;
    }
    double weight = MAX_WEIGHT - (MAX_WEIGHT - MIN_WEIGHT) * index / (count - 1);
    return Math.min(MAX_WEIGHT, Math.max(MIN_WEIGHT, weight));
  }

  /**
   * Looks up the tier for a document type.
   *
   * @param docType lower-case document type
   * @return tier, or empty when the type is not ranked
   */
  public OptionalInt doctypeTier(String docType) {
    Integer tier = docType == null ? null : doctypeTiers.get(docType);
    return tier == null ? OptionalInt.empty() : OptionalInt.of(tier);
  }

  public Map<String, Integer> doctypeTiers() {
    return doctypeTiers;
  }

  /**
   * Returns the discipline weights for a collection tag, resolving aliases of discipline tags.
   *
   * @param collection normalized collection tag
   * @return weights for the disciplines the collection maps to; empty when the tag is unknown
   */
  public Map<Discipline, Double> collectionWeights(String collection) {
    Map<Discipline, Double> row = collectionWeights.get(collection);
    if (row == null) {
      row = Discipline.fromTag(collection).map(d -> collectionWeights.get(d.tag())).orElse(null);
    }
    return row == null ? Map.of() : row;
  }

  /**
   * Returns all configured collection rows.
   *
   * @return unmodifiable map
   */
  public Map<String, Map<Discipline, Double>> collectionWeights() {
    return collectionWeights;
  }
}
