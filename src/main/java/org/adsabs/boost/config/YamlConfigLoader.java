package org.adsabs.boost.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads pipeline configuration from a YAML document and flattens sections into dotted key/value
 * maps.
 *
 * <p>Nested mappings become dotted keys, so {@code ranking: {collections: {physics: {physics: 1}}}}
 * yields {@code ranking.collections.physics.physics=1}. Numeric mapping keys such as doctype tiers
 * are accepted.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode (run, listen, query, export)
   * @return optional flat map containing merged configuration; empty when the file is absent
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(load(reader, mode));
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse YAML config at " + path, ex);
    }
  }

  static Map<String, String> load(Reader reader, String mode) {
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Object document = new Yaml().load(reader);
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");

    Map<String, String> flattened = new LinkedHashMap<>();
    Object commonSection = findSection(root, "common");
    if (commonSection != null) {
      flatten(asMap(commonSection, "common"), "", flattened);
    }
    Object modeSection = findSection(root, normalizedMode);
    if (modeSection != null) {
      flatten(asMap(modeSection, normalizedMode), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigurationException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object key = entry.getKey();
      if (key instanceof String || key instanceof Number || key instanceof Boolean) {
        map.put(String.valueOf(key), entry.getValue());
      } else {
        throw new ConfigurationException(context + " section contains unsupported key: " + key);
      }
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new ConfigurationException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new ConfigurationException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
