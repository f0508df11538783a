package ca.gc.cra.midscan.validation;

/**
 * Numeric parsing and range checks.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures a value lies within an inclusive range.
   *
   * @param name value name used in error messages
   * @param value value to check
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return the value
   * @throws IllegalArgumentException if the value is out of range
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
   * Parses an integer option and checks its range.
   *
   * @param name option name
   * @param raw raw text
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + raw + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
