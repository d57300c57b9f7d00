package org.adsabs.boost.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.adsabs.boost.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and histograms to OpenTelemetry.
 *
 * <p>Per-stage keys of the form {@code boost.stage.<stage>.<suffix>} are folded into a single
 * instrument {@code boost.stage.<suffix>} carrying a {@code boost.stage} attribute, so dashboards
 * can group by stage. Other keys map one-to-one onto instrument names.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> STAGE_ATTRIBUTE = AttributeKey.stringKey("boost.stage");
  private static final String STAGE_PREFIX = "boost.stage.";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings telemetry settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> resolve(k, name -> meter.counterBuilder(name).setUnit("1").setDescription("Boost pipeline counter " + name).build()));
    instrument.value().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> resolve(k, name -> meter.histogramBuilder(name).ofLongs().setDescription("Boost pipeline observation " + name).build()));
    instrument.value().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private static <T> Instrument<T> resolve(String key, Function<String, T> builder) {
    if (key.startsWith(STAGE_PREFIX)) {
      String rest = key.substring(STAGE_PREFIX.length());
      int dot = rest.indexOf('.');
      if (dot > 0 && dot < rest.length() - 1) {
        String stage = rest.substring(0, dot);
        String name = STAGE_PREFIX + rest.substring(dot + 1);
        return new Instrument<>(builder.apply(name), Attributes.of(STAGE_ATTRIBUTE, stage));
      }
    }
    return new Instrument<>(builder.apply(key), Attributes.empty());
  }

  private record Instrument<T>(T value, Attributes attributes) {}
}
