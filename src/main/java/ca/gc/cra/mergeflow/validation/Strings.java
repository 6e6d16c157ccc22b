package ca.gc.cra.mergeflow.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by MERGEFLOW configuration and source resolution.
 * <p><strong>Why:</strong> Source specifications and delimiters are checked before any source is opened so
 * failures surface at configuration time.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise
 * {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
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
   * @return input with surrounding whitespace stripped
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.strip();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is exactly one character that can act as a field delimiter.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return the delimiter character
   * @throws IllegalArgumentException if the value is not a single character, or is a quote, CR, or LF
   */
  public static char requireDelimiter(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (raw.length() != 1) {
      throw new IllegalArgumentException(message(name, "must be a single character (was '" + raw + "')"));
    }
    return requireDelimiter(name, raw.charAt(0));
  }

  /**
   * Ensures a character can act as a field delimiter.
   *
   * @param name logical parameter name for diagnostics
   * @param delimiter candidate delimiter
   * @return the validated delimiter
   * @throws IllegalArgumentException if the delimiter is a double quote, CR, or LF
   */
  public static char requireDelimiter(String name, char delimiter) {
    if (delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
      throw new IllegalArgumentException(message(name, "must not be a quote or line terminator"));
    }
    return delimiter;
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
