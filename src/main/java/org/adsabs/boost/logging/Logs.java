package org.adsabs.boost.logging;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Logging hygiene helpers that keep payload dumps short and secrets out of operator output.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Shortens a value to at most {@code maxChars} characters, noting the full length.
   *
   * @param value text; {@code null} yields {@code "<null>"}
   * @param maxChars characters to keep; must be positive
   * @return the value, or its prefix followed by {@code "... (truncated, N chars)"}
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + value.length() + " chars)";
  }

  /**
   * Returns a sorted copy of {@code config} with secret-looking values replaced.
   *
   * @param config configuration to print
   * @return printable configuration
   */
  public static Map<String, String> redactSecrets(Map<String, String> config) {
    Map<String, String> printable = new TreeMap<>();
    config.forEach((key, value) -> printable.put(key, isSecret(key) && value != null && !value.isEmpty()
        ? REDACTED_PLACEHOLDER
        : value));
    return printable;
  }

  private static boolean isSecret(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    return lower.contains("password") || lower.contains("secret") || lower.contains("token");
  }
}
