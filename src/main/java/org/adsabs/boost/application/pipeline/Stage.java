package org.adsabs.boost.application.pipeline;

import java.util.Locale;

/**
 * Steps a record passes through, in order.
 *
 * @since 0.1.0
 */
public enum Stage {
  VALIDATE,
  COMPUTE,
  STORE,
  SEND;

  /**
   * Returns the lower-case name used in metric keys and log context.
   *
   * @return stage label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Builds a metric key of the form {@code boost.stage.<stage>.<suffix>}.
   *
   * @param suffix metric suffix
   * @return metric key
   */
  public String metric(String suffix) {
    return "boost.stage." + label() + "." + suffix;
  }
}
