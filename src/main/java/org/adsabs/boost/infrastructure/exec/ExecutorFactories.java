package org.adsabs.boost.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named thread pools used by stage schedulers and workers.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Creates a fixed-size pool of non-daemon stage workers with an unbounded queue, so submissions
   * never block or get rejected while the pool is open.
   *
   * @param size worker count; must be positive
   * @param prefix thread name prefix
   * @param handler uncaught exception handler; may be {@code null}
   * @return executor service
   */
  public static ExecutorService newStagePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, "boost-stage", false, handler));
  }

  /**
   * Creates a single daemon thread that fires delayed retries and stage timeouts.
   *
   * @param prefix thread name prefix
   * @return scheduled executor
   */
  public static ScheduledExecutorService newRetryTimer(String prefix) {
    ScheduledThreadPoolExecutor timer =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, "boost-retry", true, null));
    timer.setRemoveOnCancelPolicy(true);
    return timer;
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
