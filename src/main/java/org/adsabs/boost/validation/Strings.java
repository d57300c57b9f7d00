package org.adsabs.boost.validation;

import java.util.Arrays;
import java.util.List;
import org.adsabs.boost.domain.error.ConfigurationException;

/**
 * String validation helpers for configuration and CLI input.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {}

  /**
   * Returns the trimmed value, rejecting blanks.
   *
   * @param name setting name
   * @param value value
   * @return trimmed value
   * @throws ConfigurationException if blank
   */
  public static String requireNonBlank(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(name + " must not be blank");
    }
    return value.trim();
  }

  /**
   * Ensures a value only contains printable ASCII and fits {@code maxLength}.
   *
   * @param name setting name
   * @param value value
   * @param maxLength maximum length
   * @return {@code value}
   * @throws ConfigurationException on violation
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (value.length() > maxLength) {
      throw new ConfigurationException(name + " exceeds " + maxLength + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new ConfigurationException(name + " must contain printable ASCII only");
      }
    }
    return value;
  }

  /**
   * Splits a comma-separated list, dropping blank entries.
   *
   * @param raw list text; may be {@code null}
   * @return trimmed entries
   */
  public static List<String> splitList(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
