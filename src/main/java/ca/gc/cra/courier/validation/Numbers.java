package ca.gc.cra.courier.validation;

/**
 * Numeric validation helpers for configuration and CLI parsing.
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
   * @param name parameter name for diagnostics; blank defaults to {@code "value"}
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name parameter name for diagnostics
   * @param raw candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not numeric or lies outside the range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long parsed;
    try {
      parsed = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + trimmed + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }
}
