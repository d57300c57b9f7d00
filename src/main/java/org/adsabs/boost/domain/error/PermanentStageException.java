package org.adsabs.boost.domain.error;

/**
 * Stage failure that would repeat on every attempt.
 *
 * @since 0.1.0
 */
public final class PermanentStageException extends StageException {
  private static final long serialVersionUID = 1L;

  public PermanentStageException(String message, Throwable cause) {
    super(ErrorKind.PERMANENT, message, cause);
  }
}
