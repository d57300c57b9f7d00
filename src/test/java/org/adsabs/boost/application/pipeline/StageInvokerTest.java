package org.adsabs.boost.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.domain.error.PermanentStageException;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;
import org.adsabs.boost.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StageInvokerTest {
  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<Long> sleeps = new ArrayList<>();
  private final StageRetryPolicy policy = new StageRetryPolicy(
      4, Duration.ofMillis(100), Duration.ofMillis(250), 2.0, Duration.ofMillis(200));
  private final StageInvoker invoker = new StageInvoker(policy, executor, metrics, sleeps::add);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void retryableFailuresAreRetriedWithBoundedBackoff() throws Exception {
    AtomicInteger calls = new AtomicInteger();

    String result = invoker.invoke(Stage.STORE, "rec-1", () -> {
      if (calls.incrementAndGet() < 4) {
        throw new RetryableStageException("deadlock", null);
      }
      return "stored";
    });

    assertEquals("stored", result);
    assertEquals(List.of(100L, 200L, 250L), sleeps);
    assertEquals(3, metrics.count("boost.stage.store.retry"));
    assertEquals(0, metrics.count("boost.stage.store.failed"));
  }

  @Test
  void permanentFailuresAreNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    StageException ex = assertThrows(StageException.class, () -> invoker.invoke(Stage.COMPUTE, "rec-2", () -> {
      calls.incrementAndGet();
      throw new PermanentStageException("bad data", null);
    }));

    assertEquals(ErrorKind.PERMANENT, ex.kind());
    assertEquals(1, calls.get());
    assertEquals(1, metrics.count("boost.stage.compute.failed"));
  }

  @Test
  void attemptsAreExhaustedAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();

    StageException ex = assertThrows(StageException.class, () -> invoker.invoke(Stage.SEND, "rec-3", () -> {
      calls.incrementAndGet();
      throw new RetryableStageException("broker down", null);
    }));

    assertEquals(ErrorKind.RETRYABLE, ex.kind());
    assertEquals(4, calls.get());
    assertEquals(1, metrics.count("boost.stage.send.failed"));
  }

  @Test
  void slowAttemptsTimeOutAsRetryable() {
    StageRetryPolicy single = new StageRetryPolicy(
        1, Duration.ZERO, Duration.ZERO, 1.0, Duration.ofMillis(50));
    StageInvoker strict = new StageInvoker(single, executor, metrics, sleeps::add);

    StageException ex = assertThrows(StageException.class, () -> strict.invoke(Stage.STORE, "rec-4", () -> {
      Thread.sleep(5_000);
      return "late";
    }));

    assertEquals(ErrorKind.RETRYABLE, ex.kind());
  }

  @Test
  void timeQueuedBehindOtherWorkDoesNotCountAgainstTheTimeout() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    executor.submit(() -> {
      release.await(5, TimeUnit.SECONDS);
      return null;
    });
    Thread releaser = new Thread(() -> {
      try {
        Thread.sleep(500);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
      release.countDown();
    });
    releaser.start();

    String result = invoker.invoke(Stage.STORE, "rec-queued", () -> "stored");

    releaser.join();
    assertEquals("stored", result);
    assertEquals(0, metrics.count("boost.stage.store.retry"));
    assertEquals(List.of(), sleeps);
  }

  @Test
  void unexpectedExceptionsArePermanent() {
    StageException ex = assertThrows(StageException.class,
        () -> invoker.invoke(Stage.COMPUTE, "rec-5", () -> {
          throw new IllegalStateException("bug");
        }));

    assertEquals(ErrorKind.PERMANENT, ex.kind());
  }

  @Test
  void backoffGrowsAndCaps() {
    assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
    assertEquals(Duration.ofMillis(200), policy.backoffAfter(2));
    assertEquals(Duration.ofMillis(250), policy.backoffAfter(5));
  }
}
