package org.astro.doppler.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for text captured from external tools.
 * <p><strong>Why:</strong> Document combiners can print whole page dumps on failure; operator logs keep only
 * a bounded prefix.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxChars} characters, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input exceeds {@code maxChars}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
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
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + ")";
  }
}
