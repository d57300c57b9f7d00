package org.adsabs.boost.validation;

import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * Numeric parsing and range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Ensures {@code value} lies in [{@code min}, {@code max}].
   *
   * @param name setting name for error messages
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws ConfigurationException if out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ConfigurationException(name + " must be between " + min + " and " + max + ": " + value);
    }
    return value;
  }

  /**
   * Parses an integer setting.
   *
   * @param name setting name
   * @param raw raw text; blank selects {@code fallback}
   * @param fallback default value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws ConfigurationException if unparsable or out of range
   */
  public static int parseInt(String name, String raw, int fallback, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return (int) requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(name + " must be an integer: " + raw, ex);
    }
  }

  /**
   * Parses a finite decimal setting.
   *
   * @param name setting name
   * @param raw raw text; blank selects {@code fallback}
   * @param fallback default value
   * @return parsed value
   * @throws ConfigurationException if unparsable or not finite
   */
  public static double parseDouble(String name, String raw, double fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      double value = Double.parseDouble(raw.trim());
      if (!Double.isFinite(value)) {
        throw new ConfigurationException(name + " must be finite: " + raw);
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(name + " must be a number: " + raw, ex);
    }
  }

  /**
   * Parses a boolean setting; only {@code true} and {@code false} are accepted.
   *
   * @param name setting name
   * @param raw raw text; blank selects {@code fallback}
   * @param fallback default value
   * @return parsed value
   */
  public static boolean parseBoolean(String name, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigurationException(name + " must be true or false: " + raw);
  }
}
