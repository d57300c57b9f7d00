package org.adsabs.boost.application.pipeline;

import java.util.Objects;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.application.port.ClockPort;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.compute.BoostComputation;
import org.adsabs.boost.domain.error.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The three stage bodies run for every record: compute, store and send.
 * <p><strong>Why:</strong> Schedulers (local worker pool or message-driven workers) decide where and
 * when each stage runs; the stage logic itself lives here once.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from thread-safe collaborators.</p>
 * <p><strong>Observability:</strong> Emits {@code boost.stage.<stage>.latencyNanos} per attempt and
 * {@code boost.store.upserted} after each successful write.</p>
 *
 * @since 0.1.0
 */
public final class BoostTaskChain {
  private static final Logger log = LoggerFactory.getLogger(BoostTaskChain.class);

  private final BoostComputation computation;
  private final BoostFactorsRepository repository;
  private final NotificationPort notifier;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public BoostTaskChain(
      BoostComputation computation,
      BoostFactorsRepository repository,
      NotificationPort notifier,
      ClockPort clock,
      MetricsPort metrics) {
    this.computation = Objects.requireNonNull(computation, "computation");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Computes boost factors for a record.
   *
   * @param request record
   * @return factors stamped with the current time
   * @throws StageException with kind VALIDATION when the record has no identifier
   */
  public BoostFactors compute(BoostRequest request) throws StageException {
    long start = System.nanoTime();
    try {
      BoostFactors factors = computation.compute(request, clock.now());
      log.debug("Computed combined boost {} for {}", factors.combinedBoost(), request.label());
      return factors;
    } finally {
      metrics.observe(Stage.COMPUTE.metric("latencyNanos"), System.nanoTime() - start);
    }
  }

  /**
   * Upserts factors.
   *
   * @param factors computed factors
   * @return the same factors, for chaining
   * @throws StageException if the repository rejects the write
   */
  public BoostFactors store(BoostFactors factors) throws StageException {
    long start = System.nanoTime();
    try {
      repository.upsert(factors);
      metrics.increment("boost.store.upserted");
      return factors;
    } finally {
      metrics.observe(Stage.STORE.metric("latencyNanos"), System.nanoTime() - start);
    }
  }

  /**
   * Publishes stored factors.
   *
   * @param factors stored factors
   * @throws StageException if the notification transport fails
   */
  public void send(BoostFactors factors) throws StageException {
    long start = System.nanoTime();
    try {
      notifier.publish(factors);
    } finally {
      metrics.observe(Stage.SEND.metric("latencyNanos"), System.nanoTime() - start);
    }
  }
}
