package ca.gc.cra.rigging.validation;

import java.util.Locale;

/**
 * <strong>What:</strong> Numeric parsing and range helpers shared by the setting validators.
 * <p><strong>Why:</strong> Integer settings such as {@code umask} are commonly written in octal or
 * hexadecimal, so text input is parsed with automatic base detection.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
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
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws ValidationException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ValidationException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer literal, inferring the base from its prefix.
   *
   * <p>{@code 0x}/{@code 0X} selects hexadecimal, a leading {@code 0} followed by more digits
   * selects octal, anything else is decimal. An optional sign precedes the prefix and surrounding
   * whitespace is ignored.</p>
   *
   * @param text literal to parse
   * @return parsed value
   * @throws ValidationException if {@code text} is not a valid literal in the inferred base
   */
  public static long parseAutoBase(String text) {
    if (text == null) {
      throw new ValidationException("Invalid integer literal: null");
    }
    String literal = text.strip();
    if (literal.isEmpty()) {
      throw new ValidationException("Invalid integer literal: '" + text + "'");
    }

    boolean negative = false;
    int index = 0;
    char first = literal.charAt(0);
    if (first == '+' || first == '-') {
      negative = first == '-';
      index = 1;
    }
    String unsigned = literal.substring(index);

    int radix = 10;
    String digits = unsigned;
    String lower = unsigned.toLowerCase(Locale.ROOT);
    if (lower.startsWith("0x")) {
      radix = 16;
      digits = unsigned.substring(2);
    } else if (unsigned.length() > 1 && unsigned.charAt(0) == '0') {
      radix = 8;
      digits = unsigned.substring(1);
    }

    if (digits.isEmpty() || !Character.isLetterOrDigit(digits.charAt(0))) {
      throw new ValidationException("Invalid integer literal: '" + text + "'");
    }
    try {
      long magnitude = Long.parseLong(digits, radix);
      return negative ? -magnitude : magnitude;
    } catch (NumberFormatException ex) {
      throw new ValidationException("Invalid integer literal: '" + text + "'", ex);
    }
  }
}
