package org.adsabs.boost.application.pipeline;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.adsabs.boost.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tallies record outcomes across all batches and reports progress every {@code cadence} records.
 *
 * <p><strong>Thread-safety:</strong> Safe for concurrent completion callbacks.</p>
 *
 * @since 0.1.0
 */
public final class ProgressTracker {
  private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

  private final int cadence;
  private final MetricsPort metrics;
  private final AtomicLong processed = new AtomicLong();
  private final LongAdder succeeded = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder dispatched = new LongAdder();

  public ProgressTracker(int cadence, MetricsPort metrics) {
    if (cadence <= 0) {
      throw new IllegalArgumentException("cadence must be positive");
    }
    this.cadence = cadence;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Records a terminal outcome.
   *
   * @param outcome outcome of one record
   */
  public void record(ChainOutcome outcome) {
    switch (outcome.status()) {
      case SUCCEEDED -> {
        succeeded.increment();
        metrics.increment("boost.records.succeeded");
        if (outcome.notificationFailed()) {
          metrics.increment("boost.notify.failed");
        }
      }
      case FAILED -> {
        failed.increment();
        metrics.increment("boost.records.failed");
      }
      case DISPATCHED -> {
        dispatched.increment();
        metrics.increment("boost.records.dispatched");
      }
    }
    long count = processed.incrementAndGet();
    if (count % cadence == 0) {
      metrics.observe("boost.progress.processed", count);
      log.info("Processed {} records ({} succeeded, {} failed, {} dispatched)",
          count, succeeded.sum(), failed.sum(), dispatched.sum());
    }
  }

  public long processed() {
    return processed.get();
  }

  public long succeeded() {
    return succeeded.sum();
  }

  public long failed() {
    return failed.sum();
  }
}
