package ca.gc.cra.midscan.domain.mailbox;

import java.util.Locale;

/**
 * Origin of the candidate mailbox names a scan plan is built from.
 *
 * @since 0.1.0
 */
public enum MailboxSource {
  /** Built-in list of conventionally important mailboxes. */
  DEFAULT,
  /** Every selectable mailbox the server enumerates. */
  ALL,
  /** Operator-supplied names. */
  EXPLICIT;

  /**
   * Interprets a {@code mailboxes=} option value: {@code DEFAULT} (or blank), {@code *}/{@code ALL}, or anything
   * else as an explicit list.
   *
   * @param value raw option value; may be {@code null}
   * @return matching source
   */
  public static MailboxSource fromOption(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    String trimmed = value.trim();
    if ("*".equals(trimmed)) {
      return ALL;
    }
    return switch (trimmed.toUpperCase(Locale.ROOT)) {
      case "DEFAULT" -> DEFAULT;
      case "ALL" -> ALL;
      default -> EXPLICIT;
    };
  }
}
