package org.adsabs.boost.application.pipeline;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.adsabs.boost.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts and logs document types missing from the ranking table. Logging is rate limited: the
 * first occurrence and then every {@value #LOG_EVERY}th are written.
 *
 * @since 0.1.0
 */
public final class UnknownDoctypeLog implements Consumer<String> {
  private static final Logger log = LoggerFactory.getLogger(UnknownDoctypeLog.class);
  static final int LOG_EVERY = 1_000;

  private final MetricsPort metrics;
  private final AtomicInteger seen = new AtomicInteger();

  public UnknownDoctypeLog(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void accept(String docType) {
    metrics.increment("boost.doctype.unknown");
    int count = seen.incrementAndGet();
    if (count == 1 || count % LOG_EVERY == 0) {
      log.warn("Unknown doctype '{}' scored with the unknown-doctype boost ({} occurrences so far)",
          docType, count);
    }
  }

  int occurrences() {
    return seen.get();
  }
}
