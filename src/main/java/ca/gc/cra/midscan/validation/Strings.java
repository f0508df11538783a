package ca.gc.cra.midscan.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * String validation helpers for operator-supplied configuration values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Validates that a value is non-blank and free of control characters.
   *
   * @param name value name used in error messages
   * @param value value to check
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank or contains control characters
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
   * Validates a bounded printable-ASCII value.
   *
   * @param name value name used in error messages
   * @param value value to check
   * @param maxLength maximum length after trimming
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping blanks.
   *
   * @param value raw list; {@code null} yields an empty list
   * @return entries in order
   */
  public static List<String> splitList(String value) {
    List<String> out = new ArrayList<>();
    if (value == null) {
      return out;
    }
    for (String token : value.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        out.add(trimmed);
      }
    }
    return out;
  }

  static boolean containsControl(CharSequence value) {
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
