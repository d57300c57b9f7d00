package org.adsabs.boost.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of disciplines for which a final boost is produced.
 *
 * <p>Each discipline has a canonical collection tag plus aliases used by upstream sources
 * (for example {@code astrophysics} for {@link #ASTRONOMY}).</p>
 *
 * @since 0.1.0
 */
public enum Discipline {
  ASTRONOMY("astronomy", "astrophysics"),
  PHYSICS("physics"),
  EARTH_SCIENCE("earth_science", "earthscience"),
  PLANETARY_SCIENCE("planetary_science", "planetary"),
  HELIOPHYSICS("heliophysics"),
  GENERAL("general");

  private final String tag;
  private final List<String> aliases;

  Discipline(String tag, String... aliases) {
    this.tag = tag;
    this.aliases = List.of(aliases);
  }

  /**
   * Returns the canonical collection tag, also used as the column and JSON field prefix.
   *
   * @return lower-case tag
   */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a collection tag or alias to a discipline.
   *
   * @param value tag as found in upstream data; case-insensitive, spaces treated as underscores
   * @return matching discipline, or empty when the tag names no discipline
   */
  public static Optional<Discipline> fromTag(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = normalizeTag(value);
    for (Discipline discipline : values()) {
      if (discipline.tag.equals(normalized) || discipline.aliases.contains(normalized)) {
        return Optional.of(discipline);
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a collection tag: trimmed, lower-cased, inner spaces replaced by underscores.
   *
   * @param value raw tag
   * @return normalized tag; empty string for {@code null}
   */
  public static String normalizeTag(String value) {
    if (value == null) {
      return "";
    }
    return value.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
  }
}
