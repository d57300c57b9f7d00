package org.adsabs.boost.application.port;

/**
 * <strong>What:</strong> Domain port for emitting pipeline counters and histograms.
 * <p><strong>Why:</strong> Keeps the orchestrator and stages independent of the metrics backend
 * (OpenTelemetry in production, recording doubles in tests).</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; stages run on many
 * workers at once.</p>
 * <p><strong>Observability:</strong> Keys are dotted names such as {@code boost.records.succeeded}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter identified by {@code key}.
   *
   * @param key metric key
   */
  void increment(String key);

  /**
   * Records a measurement for the histogram identified by {@code key}.
   *
   * @param key metric key
   * @param value observed value
   */
  void observe(String key, long value);

  /** Metrics port that discards every call. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
