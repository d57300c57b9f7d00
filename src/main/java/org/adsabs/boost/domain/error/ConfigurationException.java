package org.adsabs.boost.domain.error;

/**
 * Raised when ranking tables, weights or pipeline settings are invalid.
 *
 * <p>Unchecked: configuration errors surface at startup and terminate the process with a
 * configuration exit code.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
