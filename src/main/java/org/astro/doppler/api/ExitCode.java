package org.astro.doppler.api;

/**
 * <strong>What:</strong> Canonical exit codes of the Doppler command-line driver.
 * <p><strong>Why:</strong> Gives batch scripts a stable way to tell configuration mistakes from runtime
 * failures.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including individual-mode runs that skipped files. */
  SUCCESS(0),
  /** Command-line arguments or their combination were invalid. */
  INVALID_ARGS(2),
  /** IO failure, including a missing input in joint mode. */
  IO_ERROR(3),
  /** Configuration was missing or malformed (missing list file, no usable backend). */
  CONFIG_ERROR(4),
  /** Fitting, rendering or document combining failed. */
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
