package org.astro.doppler.infrastructure.combine;

import java.io.IOException;

/**
 * Raised when the document combiner exits with a non-zero status.
 *
 * @since 0.1.0
 */
public final class CombinerFailureException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int exitCode;

  /**
   * @param command executable that failed
   * @param exitCode process exit status
   * @param toolOutput truncated combined stdout/stderr of the tool
   */
  public CombinerFailureException(String command, int exitCode, String toolOutput) {
    super(command + " exited with status " + exitCode + (toolOutput.isBlank() ? "" : ": " + toolOutput));
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
