package org.adsabs.boost.domain.error;

/**
 * Transient stage failure; the scheduler re-runs the stage with backoff.
 *
 * @since 0.1.0
 */
public final class RetryableStageException extends StageException {
  private static final long serialVersionUID = 1L;

  public RetryableStageException(String message, Throwable cause) {
    super(ErrorKind.RETRYABLE, message, cause);
  }
}
