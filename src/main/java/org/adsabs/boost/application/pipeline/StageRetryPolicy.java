package org.adsabs.boost.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt limit, exponential backoff and per-attempt timeout applied to every stage.
 *
 * @param maxAttempts total attempts including the first
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff upper bound for any delay
 * @param multiplier growth factor between consecutive delays
 * @param stageTimeout limit for one attempt
 * @since 0.1.0
 */
public record StageRetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    Duration stageTimeout) {

  public StageRetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(initialBackoff, "initialBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    Objects.requireNonNull(stageTimeout, "stageTimeout");
    if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
    }
    if (!(multiplier >= 1.0)) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
    if (stageTimeout.isZero() || stageTimeout.isNegative()) {
      throw new IllegalArgumentException("stageTimeout must be positive");
    }
  }

  /** Five attempts, 200 ms doubling up to 10 s, 30 s per attempt. */
  public static StageRetryPolicy defaults() {
    return new StageRetryPolicy(
        5, Duration.ofMillis(200), Duration.ofSeconds(10), 2.0, Duration.ofSeconds(30));
  }

  /**
   * Returns the delay to wait after a failed attempt.
   *
   * @param failedAttempt one-based number of the attempt that just failed
   * @return delay before the next attempt
   */
  public Duration backoffAfter(int failedAttempt) {
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
    long capped = (long) Math.min(maxBackoff.toMillis(), millis);
    return Duration.ofMillis(capped);
  }

  /**
   * Indicates whether another attempt is allowed.
   *
   * @param failedAttempt one-based number of the attempt that just failed
   * @return {@code true} while attempts remain
   */
  public boolean allowsRetryAfter(int failedAttempt) {
    return failedAttempt < maxAttempts;
  }
}
