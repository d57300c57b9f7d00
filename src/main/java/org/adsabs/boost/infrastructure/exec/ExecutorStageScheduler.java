package org.adsabs.boost.infrastructure.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.adsabs.boost.application.pipeline.BoostTaskChain;
import org.adsabs.boost.application.pipeline.ChainOutcome;
import org.adsabs.boost.application.pipeline.Stage;
import org.adsabs.boost.application.pipeline.StageFailures;
import org.adsabs.boost.application.pipeline.StageRetryPolicy;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> In-process {@link StageScheduler} running compute, store and send as
 * separate tasks on a shared worker pool.
 * <p><strong>Why:</strong> Records from every batch interleave freely on the pool while each
 * record's stages stay strictly ordered.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce the per-attempt stage timeout, measured from the moment a worker starts the body.</li>
 *   <li>Re-run retryable failures after exponential backoff without occupying a worker while
 *       waiting.</li>
 *   <li>Turn a failed send into a stored-but-not-notified outcome; the stored row stays.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@link #schedule(BoostRequest)} calls.</p>
 * <p><strong>Observability:</strong> {@code boost.stage.<stage>.retry} and
 * {@code boost.stage.<stage>.failed} counters.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorStageScheduler implements StageScheduler {
  private static final Logger log = LoggerFactory.getLogger(ExecutorStageScheduler.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  @FunctionalInterface
  private interface StageBody<T> {
    T run() throws StageException;
  }

  private final BoostTaskChain chain;
  private final StageRetryPolicy policy;
  private final ExecutorService workers;
  private final ScheduledExecutorService timer;
  private final MetricsPort metrics;

  /**
   * Creates a scheduler that owns its worker pool and retry timer.
   *
   * @param chain stage bodies
   * @param policy retry and timeout policy
   * @param workerCount stage worker threads
   * @param metrics metrics sink
   */
  public ExecutorStageScheduler(
      BoostTaskChain chain, StageRetryPolicy policy, int workerCount, MetricsPort metrics) {
    this(
        chain,
        policy,
        ExecutorFactories.newStagePool(workerCount, "boost-stage",
            (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex)),
        ExecutorFactories.newRetryTimer("boost-retry"),
        metrics);
  }

  ExecutorStageScheduler(
      BoostTaskChain chain,
      StageRetryPolicy policy,
      ExecutorService workers,
      ScheduledExecutorService timer,
      MetricsPort metrics) {
    this.chain = Objects.requireNonNull(chain, "chain");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.timer = Objects.requireNonNull(timer, "timer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public CompletableFuture<ChainOutcome> schedule(BoostRequest request) {
    String label = request.label();
    return run(Stage.COMPUTE, label, () -> chain.compute(request))
        .thenCompose(factors -> run(Stage.STORE, label, () -> chain.store(factors)))
        .thenCompose(stored -> notify(label, stored))
        .exceptionally(ex -> {
          StageFailed failed = unwrapStageFailure(Stage.COMPUTE, ex);
          log.warn("Record {} failed at stage {} ({}): {}",
              label, failed.stage().label(), failed.cause().kind(), failed.cause().getMessage());
          return ChainOutcome.failed(label, failed.stage(), failed.cause().kind());
        });
  }

  private CompletableFuture<ChainOutcome> notify(String label, BoostFactors stored) {
    return run(Stage.SEND, label, () -> {
      chain.send(stored);
      return ChainOutcome.succeeded(label);
    }).exceptionally(ex -> {
      StageFailed failed = unwrapStageFailure(Stage.SEND, ex);
      log.warn("Record {} stored but notification failed ({}): {}",
          label, failed.cause().kind(), failed.cause().getMessage());
      return ChainOutcome.storedWithoutNotification(label);
    });
  }

  private <T> CompletableFuture<T> run(Stage stage, String label, StageBody<T> body) {
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(stage, label, body, 1, result);
    return result;
  }

  private <T> void attempt(Stage stage, String label, StageBody<T> body, int attempt, CompletableFuture<T> result) {
    CompletableFuture<T> current = new CompletableFuture<>();
    try {
      workers.execute(() -> runWithDeadline(stage, label, body, current));
    } catch (RejectedExecutionException ex) {
      result.completeExceptionally(new StageFailed(stage, new RetryableStageException("scheduler closed", ex)));
      return;
    }
    current.whenComplete((value, ex) -> {
      if (ex == null) {
        result.complete(value);
        return;
      }
      StageException failure = unwrapStageFailure(stage, ex).cause();
      if (failure.kind().retryable() && policy.allowsRetryAfter(attempt)) {
        long delay = policy.backoffAfter(attempt).toMillis();
        metrics.increment(stage.metric("retry"));
        log.debug("Retrying {} for {} in {} ms after attempt {}: {}",
            stage.label(), label, delay, attempt, failure.getMessage());
        try {
          timer.schedule(() -> attempt(stage, label, body, attempt + 1, result), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException rejected) {
          metrics.increment(stage.metric("failed"));
          result.completeExceptionally(new StageFailed(stage, failure));
        }
        return;
      }
      metrics.increment(stage.metric("failed"));
      result.completeExceptionally(new StageFailed(stage, failure));
    });
  }

  /**
   * Runs one attempt on the calling worker. The deadline starts when the body starts; on expiry the
   * attempt fails as retryable and the worker is interrupted if it is still inside the body.
   */
  private <T> void runWithDeadline(Stage stage, String label, StageBody<T> body, CompletableFuture<T> current) {
    Thread runner = Thread.currentThread();
    Object lock = new Object();
    boolean[] running = {true};
    long timeoutMillis = policy.stageTimeout().toMillis();
    ScheduledFuture<?> deadline;
    try {
      deadline = timer.schedule(() -> {
        TimeoutException timeout = new TimeoutException(
            stage.label() + " exceeded " + timeoutMillis + " ms for " + label);
        if (current.completeExceptionally(new StageFailed(stage, StageFailures.classify(stage, timeout)))) {
          synchronized (lock) {
            if (running[0]) {
              runner.interrupt();
            }
          }
        }
      }, timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      current.completeExceptionally(new StageFailed(stage, new RetryableStageException("scheduler closed", ex)));
      return;
    }
    try {
      current.complete(invoke(stage, label, body));
    } catch (Throwable ex) {
      current.completeExceptionally(ex);
    } finally {
      deadline.cancel(false);
      synchronized (lock) {
        running[0] = false;
        // clears an interrupt aimed at this attempt so the pool thread starts clean
        Thread.interrupted();
      }
    }
  }

  private static <T> T invoke(Stage stage, String label, StageBody<T> body) {
    MDC.put("stage", stage.label());
    MDC.put("record", label);
    try {
      return body.run();
    } catch (StageException ex) {
      throw new StageFailed(stage, ex);
    } finally {
      MDC.remove("stage");
      MDC.remove("record");
    }
  }

  private static StageFailed unwrapStageFailure(Stage fallbackStage, Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof StageFailed failed) {
        return failed;
      }
      current = current.getCause();
    }
    return new StageFailed(fallbackStage, StageFailures.classify(fallbackStage, ex));
  }

  @Override
  public void close() {
    log.info("Stopping stage workers");
    timer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Stage workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        workers.shutdownNow();
      }
    } catch (InterruptedException ie) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Carries the failing stage through future completion. */
  static final class StageFailed extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final transient Stage stage;

    StageFailed(Stage stage, StageException cause) {
      super(cause.getMessage(), cause, false, false);
      this.stage = stage;
    }

    Stage stage() {
      return stage;
    }

    @Override
    public synchronized StageException getCause() {
      return (StageException) super.getCause();
    }

    StageException cause() {
      return getCause();
    }
  }
}
