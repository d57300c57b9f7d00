package org.adsabs.boost.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.adsabs.boost.config.ConfigMerger;
import org.adsabs.boost.config.DefaultsForMode;
import org.adsabs.boost.config.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers for mixing CLI arguments with the YAML configuration file.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  static final String CONFIG_ENV = "BOOST_CONFIG";

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective configuration for a mode: CLI arguments over the YAML file over defaults.
   *
   * <p>The YAML file is taken from {@code config=PATH}, else from {@code $BOOST_CONFIG}. An explicit
   * {@code config=} path must exist.</p>
   *
   * @param mode CLI mode
   * @param cli parsed CLI arguments; the {@code config} key is removed
   * @return effective configuration
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli) throws IOException {
    String explicit = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (explicit != null) {
      Path path = Path.of(explicit);
      if (!Files.exists(path)) {
        throw new NoSuchFileException(explicit, null, "configuration file not found");
      }
      yaml = YamlConfigLoader.load(path, mode);
    } else {
      String fromEnv = System.getenv(CONFIG_ENV);
      if (fromEnv != null && !fromEnv.isBlank()) {
        yaml = YamlConfigLoader.load(Path.of(fromEnv.trim()), mode);
      }
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
