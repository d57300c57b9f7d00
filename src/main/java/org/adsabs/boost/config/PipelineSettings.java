package org.adsabs.boost.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.adsabs.boost.adapter.kafka.KafkaTopics;
import org.adsabs.boost.application.pipeline.StageRetryPolicy;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.adsabs.boost.validation.Numbers;
import org.adsabs.boost.validation.Strings;

/**
 * <strong>What:</strong> Execution settings for the pipeline: batching, workers, retries, storage
 * and transport.
 * <p><strong>Why:</strong> Consolidates the effective configuration so every CLI mode wires the same
 * components from one validated object.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param batchSize records per batch, {@code 1..100000}
 * @param progressEvery progress log cadence in records
 * @param workers stage worker threads
 * @param retry retry and timeout policy
 * @param transport {@link IoMode#LOCAL} or {@link IoMode#KAFKA}
 * @param notifyMode {@link IoMode#LOG} or {@link IoMode#KAFKA}
 * @param jdbcUrl JDBC URL of the boost factor store
 * @param jdbcUser database user
 * @param jdbcPassword database password; may be empty
 * @param initSchema create the table and indexes when absent
 * @param kafkaBootstrap bootstrap servers when any Kafka mode is active
 * @param kafkaGroup consumer group of the listen mode
 * @param topics topic names
 * @since 0.1.0
 */
public record PipelineSettings(
    int batchSize,
    int progressEvery,
    int workers,
    StageRetryPolicy retry,
    IoMode transport,
    IoMode notifyMode,
    String jdbcUrl,
    String jdbcUser,
    String jdbcPassword,
    boolean initSchema,
    Optional<String> kafkaBootstrap,
    String kafkaGroup,
    KafkaTopics topics) {
  static final int MAX_BATCH_SIZE = 100_000;

  public PipelineSettings {
    Numbers.requireRange("batchSize", batchSize, 1, MAX_BATCH_SIZE);
    Numbers.requireRange("progressEvery", progressEvery, 1, Integer.MAX_VALUE);
    Numbers.requireRange("workers", workers, 1, 1024);
    Objects.requireNonNull(retry, "retry");
    if (transport != IoMode.LOCAL && transport != IoMode.KAFKA) {
      throw new ConfigurationException("transport must be local or kafka: " + transport);
    }
    if (notifyMode != IoMode.LOG && notifyMode != IoMode.KAFKA) {
      throw new ConfigurationException("notify must be log or kafka: " + notifyMode);
    }
    jdbcUrl = Strings.requireNonBlank("jdbcUrl", jdbcUrl);
    jdbcUser = jdbcUser == null ? "" : jdbcUser.trim();
    jdbcPassword = jdbcPassword == null ? "" : jdbcPassword;
    kafkaBootstrap = kafkaBootstrap == null ? Optional.empty() : kafkaBootstrap.filter(s -> !s.isBlank());
    if ((transport == IoMode.KAFKA || notifyMode == IoMode.KAFKA) && kafkaBootstrap.isEmpty()) {
      throw new ConfigurationException("kafkaBootstrap is required when transport or notify is kafka");
    }
    kafkaGroup = kafkaGroup == null || kafkaGroup.isBlank() ? "boost-pipeline" : kafkaGroup.trim();
    Objects.requireNonNull(topics, "topics");
  }

  static int defaultWorkers() {
    return Math.max(2, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Reads settings from the effective configuration.
   *
   * @param config merged configuration
   * @return validated settings
   * @throws ConfigurationException if any value is missing or invalid
   */
  public static PipelineSettings fromMap(Map<String, String> config) {
    Objects.requireNonNull(config, "config");
    StageRetryPolicy defaults = StageRetryPolicy.defaults();
    StageRetryPolicy retry;
    try {
      retry = new StageRetryPolicy(
          Numbers.parseInt("retry.maxAttempts", config.get("retry.maxAttempts"), defaults.maxAttempts(), 1, 100),
          millis(config, "retry.initialBackoffMs", defaults.initialBackoff()),
          millis(config, "retry.maxBackoffMs", defaults.maxBackoff()),
          Numbers.parseDouble("retry.multiplier", config.get("retry.multiplier"), defaults.multiplier()),
          millis(config, "stage.timeoutMs", defaults.stageTimeout()));
    } catch (ConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("invalid retry settings: " + ex.getMessage(), ex);
    }
    return new PipelineSettings(
        Numbers.parseInt("batchSize", config.get("batchSize"), 100, 1, MAX_BATCH_SIZE),
        Numbers.parseInt("progressEvery", config.get("progressEvery"), 100, 1, Integer.MAX_VALUE),
        Numbers.parseInt("workers", config.get("workers"), defaultWorkers(), 1, 1024),
        retry,
        IoMode.fromString("transport", config.get("transport"), IoMode.LOCAL),
        IoMode.fromString("notify", config.get("notify"), IoMode.LOG),
        config.get("jdbcUrl"),
        config.get("jdbcUser"),
        config.get("jdbcPassword"),
        Numbers.parseBoolean("jdbcInitSchema", config.get("jdbcInitSchema"), false),
        Optional.ofNullable(config.get("kafkaBootstrap")).map(String::trim),
        config.get("kafkaGroup"),
        KafkaTopics.fromMap(config));
  }

  private static Duration millis(Map<String, String> config, String key, Duration fallback) {
    return Duration.ofMillis(
        Numbers.parseInt(key, config.get(key), (int) fallback.toMillis(), 0, Integer.MAX_VALUE));
  }
}
