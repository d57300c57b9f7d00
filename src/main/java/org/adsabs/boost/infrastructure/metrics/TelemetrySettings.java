package org.adsabs.boost.infrastructure.metrics;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Metrics export settings resolved from the effective configuration, with environment fallbacks.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP endpoint
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new ConfigurationException("metricsExporter must be 'otlp' or 'none': " + exporter);
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Exporter disabled. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  /**
   * Reads {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}, falling
   * back to the standard {@code OTEL_*} environment variables when a key is blank.
   *
   * @param config effective configuration
   * @return settings
   */
  public static TelemetrySettings fromMap(Map<String, String> config) {
    Objects.requireNonNull(config, "config");
    return new TelemetrySettings(
        firstNonBlank(config.get("metricsExporter"), System.getenv("OTEL_METRICS_EXPORTER")),
        firstNonBlank(config.get("otelEndpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT")),
        firstNonBlank(config.get("otelResourceAttributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES")));
  }

  public boolean enabled() {
    return exporter.equals("otlp");
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second;
  }
}
