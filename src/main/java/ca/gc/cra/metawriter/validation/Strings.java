package ca.gc.cra.metawriter.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation for names that end up in log prefixes and file names.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-blank and free of control characters.
   *
   * @param name setting name used in diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    return trimmed;
  }

  /**
   * Ensures a value can be used as a single file-name component.
   *
   * @param name setting name used in diagnostics
   * @param value candidate file-name prefix
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, contains a path separator, or is a relative path step
   */
  public static String requireFileNameComponent(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.indexOf('/') >= 0 || trimmed.indexOf('\\') >= 0) {
      throw new IllegalArgumentException(label(name) + " must not contain path separators");
    }
    if (trimmed.equals(".") || trimmed.equals("..")) {
      throw new IllegalArgumentException(label(name) + " must not be a relative path step");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
