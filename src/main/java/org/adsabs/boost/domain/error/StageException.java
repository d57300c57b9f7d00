package org.adsabs.boost.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Checked failure raised by a pipeline stage.
 * <p><strong>Why:</strong> Carries the {@link ErrorKind} so schedulers can decide between retry and
 * giving up without inspecting driver-specific exception types.</p>
 *
 * @since 0.1.0
 */
public class StageException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Creates a stage failure.
   *
   * @param kind failure category
   * @param message human readable description
   * @param cause underlying cause; may be {@code null}
   */
  public StageException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}
