package org.adsabs.boost.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws ConfigurationException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    requireBootstrapWhenKafka("transport", effective);
    requireBootstrapWhenKafka("notify", effective);
    if ("listen".equalsIgnoreCase(mode) && !"kafka".equalsIgnoreCase(trim(effective.get("transport")))) {
      throw new ConfigurationException("listen requires transport=kafka");
    }
  }

  private static void requireBootstrapWhenKafka(String key, Map<String, String> effective) {
    if ("kafka".equalsIgnoreCase(trim(effective.get(key)))
        && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new ConfigurationException("kafkaBootstrap is required when " + key + "=kafka");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
