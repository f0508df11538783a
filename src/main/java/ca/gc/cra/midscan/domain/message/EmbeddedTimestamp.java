package ca.gc.cra.midscan.domain.message;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the creation timestamp some mailers embed at the front of generated identifiers, for example
 * {@code 20240213212126.4429A161827048B0@gmail.com}.
 *
 * <p>The value is read as {@code YYYYMMDDHHMMSS} in the ISO calendar with no zone conversion. Absence of a
 * timestamp is a normal outcome and only disables the time-window search.</p>
 *
 * @since 0.1.0
 */
public final class EmbeddedTimestamp {
  private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d{14})[.\\-@]");
  private static final DateTimeFormatter DIGITS = new DateTimeFormatterBuilder()
      .appendValue(ChronoField.YEAR, 4)
      .appendValue(ChronoField.MONTH_OF_YEAR, 2)
      .appendValue(ChronoField.DAY_OF_MONTH, 2)
      .appendValue(ChronoField.HOUR_OF_DAY, 2)
      .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
      .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
      .toFormatter()
      .withResolverStyle(ResolverStyle.STRICT);

  private EmbeddedTimestamp() {
    // Utility
  }

  /**
   * Reads the embedded timestamp from a normalized identifier.
   *
   * @param identifier identifier to inspect; must not be {@code null}
   * @return timestamp when the leading 14 digits form a valid date-time followed by {@code .}, {@code -} or
   *     {@code @}; otherwise empty
   */
  public static Optional<LocalDateTime> extract(MessageIdentifier identifier) {
    return extract(identifier.bare());
  }

  /**
   * Reads the embedded timestamp from raw identifier text.
   *
   * @param raw identifier text; delimiters are tolerated
   * @return parsed timestamp or empty
   */
  public static Optional<LocalDateTime> extract(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String bare = MessageIdentifier.parse(raw).bare();
    Matcher matcher = LEADING_DIGITS.matcher(bare);
    if (!matcher.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDateTime.parse(matcher.group(1), DIGITS));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
