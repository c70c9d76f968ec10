package org.astro.doppler.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied to the Doppler CLI and configuration layers.
 * <p><strong>Why:</strong> Ensures reader names, backend names and path arguments reach the fitting
 * pipeline sanitized, so collaborators never see blank or control-character input.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked before ports allocate file or process resources.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Verify printable ASCII constraints for telemetry attribute strings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Returns {@code true} when the value contains at least one ISO control character.
   *
   * @param value candidate text; {@code null} is treated as clean
   * @return whether a control character is present
   */
  public static boolean containsControl(CharSequence value) {
    if (value == null) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
