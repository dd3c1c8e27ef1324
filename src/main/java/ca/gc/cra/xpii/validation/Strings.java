package ca.gc.cra.xpii.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for configuration strings such as agent names and file prefixes.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
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
   * @return trimmed input
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
   * Ensures a value can be used as a file-name prefix: non-blank, no path separators, no {@code ..}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate prefix
   * @return trimmed prefix
   * @throws IllegalArgumentException if the prefix could redirect output to another directory
   */
  public static String requireFileNamePrefix(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.indexOf('/') >= 0 || sanitized.indexOf('\\') >= 0 || sanitized.contains("..")) {
      throw new IllegalArgumentException(message(name, "must not contain path separators or '..'"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
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
