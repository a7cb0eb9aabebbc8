package ca.gc.cra.metawriter.validation;

/**
 * <strong>What:</strong> Numeric parsing and range checks for configuration values.
 * <p><strong>Why:</strong> Flush frequencies, timeouts and buffer capacities arrive as strings from YAML and the
 * command line; they are checked here before a writer is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name setting name used in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return {@code value}
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
   * Parses an integer setting and checks its range.
   *
   * @param name setting name used in diagnostics
   * @param raw text to parse; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is absent
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return (int) requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a non-negative decimal setting.
   *
   * @param name setting name used in diagnostics
   * @param raw text to parse; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is absent
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a finite, non-negative number
   */
  public static double parseNonNegative(String name, String raw, double defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException(label(name) + " must be a non-negative number (was " + raw + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
