package org.adsabs.boost.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in ranking tables used when the configuration provides none.
 *
 * @since 0.1.0
 */
final class RankingDefaults {
  private RankingDefaults() {}

  /** Document type tiers; 1 is the most valuable. */
  static Map<String, Integer> doctypes() {
    Map<String, Integer> tiers = new LinkedHashMap<>();
    tiers.put("article", 1);
    tiers.put("eprint", 1);
    tiers.put("inproceedings", 2);
    tiers.put("inbook", 1);
    tiers.put("abstract", 4);
    tiers.put("book", 1);
    tiers.put("bookreview", 4);
    tiers.put("catalog", 2);
    tiers.put("circular", 3);
    tiers.put("erratum", 6);
    tiers.put("mastersthesis", 3);
    tiers.put("newsletter", 5);
    tiers.put("obituary", 6);
    tiers.put("phdthesis", 3);
    tiers.put("pressrelease", 7);
    tiers.put("proceedings", 3);
    tiers.put("proposal", 4);
    tiers.put("software", 2);
    tiers.put("talk", 4);
    tiers.put("techreport", 3);
    tiers.put("misc", 8);
    return tiers;
  }

  /** Relevance rank of each discipline per collection; 1 is the most relevant. */
  static Map<String, Map<String, Integer>> collections() {
    Map<String, Map<String, Integer>> ranks = new LinkedHashMap<>();
    ranks.put("astrophysics", row(1, 2, 6, 4, 4, 3));
    ranks.put("physics", row(3, 1, 3, 3, 3, 2));
    ranks.put("earthscience", row(6, 3, 1, 4, 5, 2));
    ranks.put("planetary", row(5, 2, 4, 1, 2, 3));
    ranks.put("heliophysics", row(6, 2, 4, 3, 1, 2));
    ranks.put("general", row(1, 1, 1, 1, 1, 1));
    return ranks;
  }

  private static Map<String, Integer> row(
      int astronomy, int physics, int earthScience, int planetary, int heliophysics, int general) {
    Map<String, Integer> row = new LinkedHashMap<>();
    row.put("astronomy", astronomy);
    row.put("physics", physics);
    row.put("earth_science", earthScience);
    row.put("planetary_science", planetary);
    row.put("heliophysics", heliophysics);
    row.put("general", general);
    return row;
  }
}
