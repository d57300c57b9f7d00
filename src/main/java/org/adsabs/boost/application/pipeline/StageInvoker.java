package org.adsabs.boost.application.pipeline;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.domain.error.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one stage body synchronously with the per-attempt timeout and retries of a
 * {@link StageRetryPolicy}. The timeout covers the body only, not time spent queued on the
 * executor.
 *
 * <p>Used by message-driven stage workers, which must finish a record before committing its
 * offset.</p>
 *
 * @since 0.1.0
 */
public final class StageInvoker {
  private static final Logger log = LoggerFactory.getLogger(StageInvoker.class);
  private static final long QUEUE_POLL_MILLIS = 100;

  /** Stage body. */
  @FunctionalInterface
  public interface StageCall<T> {
    T call() throws Exception;
  }

  /** Pause between attempts; replaced in tests to avoid real sleeps. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final StageRetryPolicy policy;
  private final ExecutorService executor;
  private final MetricsPort metrics;
  private final Sleeper sleeper;

  public StageInvoker(StageRetryPolicy policy, ExecutorService executor, MetricsPort metrics) {
    this(policy, executor, metrics, Thread::sleep);
  }

  StageInvoker(StageRetryPolicy policy, ExecutorService executor, MetricsPort metrics, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Invokes {@code call}, retrying retryable failures with backoff.
   *
   * @param stage stage being run
   * @param label record label for logs
   * @param call stage body
   * @param <T> result type
   * @return stage result
   * @throws StageException the last failure once it is not retryable or attempts are exhausted
   */
  public <T> T invoke(Stage stage, String label, StageCall<T> call) throws StageException {
    MDC.put("stage", stage.label());
    MDC.put("record", label);
    try {
      int attempt = 1;
      while (true) {
        try {
          return runOnce(call);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          metrics.increment(stage.metric("failed"));
          throw StageFailures.classify(stage, ie);
        } catch (Exception ex) {
          StageException failure = StageFailures.classify(stage, ex);
          if (!failure.kind().retryable() || !policy.allowsRetryAfter(attempt)) {
            metrics.increment(stage.metric("failed"));
            throw failure;
          }
          long delay = policy.backoffAfter(attempt).toMillis();
          metrics.increment(stage.metric("retry"));
          log.warn("Retrying {} for {} after attempt {} failed: {} (backoff {} ms)",
              stage.label(), label, attempt, failure.getMessage(), delay);
          try {
            sleeper.sleep(delay);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw StageFailures.classify(stage, ie);
          }
          attempt++;
        }
      }
    } finally {
      MDC.remove("stage");
      MDC.remove("record");
    }
  }

  private <T> T runOnce(StageCall<T> call) throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    Future<T> future = executor.submit(() -> {
      started.countDown();
      return call.call();
    });
    try {
      awaitStart(started, future);
      return future.get(policy.stageTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      throw ex;
    }
  }

  /** Waits, without a deadline, until a worker picks the task up; queue time is not stage time. */
  private void awaitStart(CountDownLatch started, Future<?> future) throws InterruptedException {
    while (!started.await(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (future.isDone() || executor.isTerminated()) {
        throw new RejectedExecutionException("stage executor stopped before the task started");
      }
    }
  }
}
