package org.adsabs.boost.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the pipeline's command-line modes.
 * <p><strong>Why:</strong> Gives schedulers and scripts consistent process status semantics.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution; individual record failures are reported, not fatal. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration or ranking tables were missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
