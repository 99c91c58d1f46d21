package ca.gc.cra.rigging.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String helpers used by the setting validators and the CLI layer.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
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
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws ValidationException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.strip();
    if (trimmed.isEmpty()) {
      throw new ValidationException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new ValidationException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Reports whether every character of {@code value} is an ASCII digit.
   *
   * @param value candidate text
   * @return {@code true} for a non-empty digit-only string
   */
  public static boolean isDigits(CharSequence value) {
    if (value == null || value.length() == 0) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  /**
   * Reports whether {@code value} contains an ISO control character.
   *
   * @param value candidate text
   * @return {@code true} when a control character is present
   */
  public static boolean containsControl(CharSequence value) {
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
