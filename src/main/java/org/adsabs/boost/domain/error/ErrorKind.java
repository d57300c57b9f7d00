package org.adsabs.boost.domain.error;

/**
 * Failure categories used to decide whether a pipeline stage may be retried.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Input record is malformed; never retried. */
  VALIDATION,
  /** Ranking tables or settings are invalid; fatal at startup. */
  CONFIGURATION,
  /** Transient failure such as a lost connection or a timeout. */
  RETRYABLE,
  /** Failure that repeats on every attempt, for example a constraint violation. */
  PERMANENT;

  /**
   * Indicates whether a stage failing with this kind should be attempted again.
   *
   * @return {@code true} only for {@link #RETRYABLE}
   */
  public boolean retryable() {
    return this == RETRYABLE;
  }
}
