package org.osp.xrit.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and the CLI.
 * <p><strong>Why:</strong> Guards against invalid timeouts, retry ceilings and sweep intervals before the
 * registry and scheduler are built.</p>
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
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g. seconds)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer, naming the parameter when parsing fails.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a valid long
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a decimal integer that must fit in an {@code int}.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or overflows {@code int}
   */
  public static int parseInt(String name, String raw) {
    return (int) requireRange(name, parseLong(name, raw), Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  /**
   * Parses a finite decimal number, naming the parameter when parsing fails.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a finite number
   */
  public static double parseFiniteDouble(String name, String raw) {
    double value;
    try {
      value = Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be finite (was '" + raw + "')");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
