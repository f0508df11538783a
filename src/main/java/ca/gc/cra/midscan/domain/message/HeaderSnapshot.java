package ca.gc.cra.midscan.domain.message;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Reporting subset of a message's headers.
 * <p><strong>Why:</strong> Hint filtering needs the sender and result reporting needs from/to/subject/date without
 * downloading whole messages.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param from {@code From} header value; empty when absent
 * @param to {@code To} header value; empty when absent
 * @param subject {@code Subject} header value; empty when absent
 * @param date {@code Date} header value; empty when absent
 * @param messageId {@code Message-ID} header value; empty when absent
 * @since 0.1.0
 */
public record HeaderSnapshot(String from, String to, String subject, String date, String messageId) {

  /**
   * Normalizes {@code null} fields to empty strings.
   */
  public HeaderSnapshot {
    from = from == null ? "" : from;
    to = to == null ? "" : to;
    subject = subject == null ? "" : subject;
    date = date == null ? "" : date;
    messageId = messageId == null ? "" : messageId;
  }

  /**
   * Returns a snapshot with every field empty.
   *
   * @return empty snapshot
   */
  public static HeaderSnapshot empty() {
    return new HeaderSnapshot("", "", "", "", "");
  }

  /**
   * Parses a raw header block such as the payload of {@code BODY[HEADER.FIELDS (...)]}.
   *
   * <p>Field names match case-insensitively and folded continuation lines are joined with a single space.
   * When a field repeats, the first occurrence wins.</p>
   *
   * @param raw raw header block; {@code null} yields {@link #empty()}
   * @return parsed snapshot
   */
  public static HeaderSnapshot parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return empty();
    }
    String from = null;
    String to = null;
    String subject = null;
    String date = null;
    String messageId = null;
    for (String field : unfold(raw)) {
      int colon = field.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String name = field.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = field.substring(colon + 1).trim();
      switch (name) {
        case "from" -> from = from == null ? value : from;
        case "to" -> to = to == null ? value : to;
        case "subject" -> subject = subject == null ? value : subject;
        case "date" -> date = date == null ? value : date;
        case "message-id" -> messageId = messageId == null ? value : messageId;
        default -> {
          // not reported
        }
      }
    }
    return new HeaderSnapshot(from, to, subject, date, messageId);
  }

  /**
   * Applies a decoder (for example RFC 2047 encoded-word decoding) to the human-readable fields.
   *
   * @param decoder decoder applied to from, to and subject
   * @return decoded snapshot
   */
  public HeaderSnapshot decode(UnaryOperator<String> decoder) {
    return new HeaderSnapshot(
        decoder.apply(from), decoder.apply(to), decoder.apply(subject), date, messageId);
  }

  private static List<String> unfold(String raw) {
    List<String> fields = new ArrayList<>();
    StringBuilder current = null;
    for (String line : raw.split("\\r?\\n")) {
      if (line.isEmpty()) {
        continue;
      }
      char first = line.charAt(0);
      if ((first == ' ' || first == '\t') && current != null) {
        current.append(' ').append(line.strip());
        continue;
      }
      if (current != null) {
        fields.add(current.toString());
      }
      current = new StringBuilder(line);
    }
    if (current != null) {
      fields.add(current.toString());
    }
    return fields;
  }
}
