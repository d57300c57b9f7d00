package org.adsabs.boost.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.adapter.kafka.KafkaTopics;
import org.adsabs.boost.application.pipeline.StageRetryPolicy;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys. Ranking tables are not
 * listed here; {@link BoostConfig} falls back to its built-in tables when no {@code ranking.*} key
 * is present.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (run, listen, query, export)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws ConfigurationException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "listen" -> buildListenDefaults();
      case "query", "export" -> buildLookupDefaults();
      default -> throw new ConfigurationException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    StageRetryPolicy retry = StageRetryPolicy.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("jdbcUrl", "jdbc:postgresql://localhost:5432/boost");
    map.put("jdbcUser", "boost");
    map.put("jdbcPassword", "");
    map.put("jdbcInitSchema", "false");
    map.put("stage.timeoutMs", Long.toString(retry.stageTimeout().toMillis()));
    map.put("retry.maxAttempts", Integer.toString(retry.maxAttempts()));
    map.put("retry.initialBackoffMs", Long.toString(retry.initialBackoff().toMillis()));
    map.put("retry.maxBackoffMs", Long.toString(retry.maxBackoff().toMillis()));
    map.put("retry.multiplier", Double.toString(retry.multiplier()));
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("file", "");
    map.put("batchSize", "100");
    map.put("progressEvery", "100");
    map.put("workers", Integer.toString(PipelineSettings.defaultWorkers()));
    map.put("transport", "local");
    map.put("notify", "log");
    map.put("kafkaBootstrap", "");
    putTopics(map);
    return map;
  }

  private static Map<String, String> buildListenDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workers", Integer.toString(PipelineSettings.defaultWorkers()));
    map.put("transport", "kafka");
    map.put("notify", "kafka");
    map.put("kafkaBootstrap", "");
    map.put("kafkaGroup", "boost-pipeline");
    putTopics(map);
    return map;
  }

  private static Map<String, String> buildLookupDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("bibcodes", "");
    map.put("scixIds", "");
    map.put("out", "");
    return map;
  }

  private static void putTopics(Map<String, String> map) {
    KafkaTopics topics = KafkaTopics.defaults();
    map.put("topics.intake", topics.intake());
    map.put("topics.compute", topics.compute());
    map.put("topics.store", topics.store());
    map.put("topics.send", topics.send());
    map.put("topics.response", topics.response());
  }
}
