package org.adsabs.boost.domain.error;

/**
 * Raised when an inbound record cannot be processed, for example when it carries neither a
 * bibcode nor a scix_id.
 *
 * @since 0.1.0
 */
public final class ValidationException extends StageException {
  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message, null);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }
}
