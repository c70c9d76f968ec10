package org.astro.doppler.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by Doppler CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards fitting thresholds such as the S/N cutoff before they reach the engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Parses a decimal option value and checks it is finite and not below {@code min}.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value supplied by the operator
   * @param min minimum inclusive value
   * @return the parsed value
   * @throws IllegalArgumentException if the text is not a number, is not finite, or is below {@code min}
   */
  public static double parseFiniteAtLeast(String name, String raw, double min) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    double value;
    try {
      value = Double.parseDouble(Strings.requireNonBlank(label, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be a number (was '" + raw + "')", ex);
    }
    return requireFiniteAtLeast(label, value, min);
  }

  /**
   * Validates that a decimal value is finite and not below {@code min}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if the value is NaN, infinite, or below {@code min}
   */
  public static double requireFiniteAtLeast(String name, double value, double min) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label + " must be finite (was " + value + ")");
    }
    if (value < min) {
      throw new IllegalArgumentException(label + " must be >= " + min + " (was " + value + ")");
    }
    return value;
  }
}
