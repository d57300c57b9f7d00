package org.adsabs.boost.application.port;

import java.time.Instant;

/**
 * Source of wall-clock time for computation timestamps and recency.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current time in epoch milliseconds.
   *
   * @return epoch milliseconds
   */
  long nowMillis();

  /**
   * Returns the current time as an instant with millisecond precision.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
