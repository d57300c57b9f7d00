package org.adsabs.boost.config;

import java.util.Locale;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * <strong>What:</strong> Transport choices for the stage channels and the notification gateway.
 * <p><strong>Why:</strong> Determines whether stages run in process or hand off through Kafka topics,
 * and whether notifications are logged or published.</p>
 *
 * @since 0.1.0
 */
public enum IoMode {
  /** In-process execution. */
  LOCAL,
  /** Structured log output; notification gateway only. */
  LOG,
  /** Apache Kafka topics. */
  KAFKA;

  /**
   * Parses a mode, returning {@code fallback} when blank.
   *
   * @param key configuration key, for error messages
   * @param value textual representation such as {@code "local"} or {@code "kafka"}
   * @param fallback mode used when {@code value} is blank
   * @return parsed mode
   * @throws ConfigurationException if the string does not match a known mode
   */
  public static IoMode fromString(String key, String value, IoMode fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return IoMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Unknown " + key + ": " + value, ex);
    }
  }
}
