package ca.gc.cra.midscan.application.port;

import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.util.List;

/**
 * Flat tabular projection of a {@link ResolutionResult}.
 *
 * <p>Unmatched identifiers keep the identifier and leave every other column empty, {@code matched} included.</p>
 *
 * @param messageId bare identifier
 * @param matched {@code "true"} for a match, empty otherwise
 * @param mailbox matching mailbox
 * @param tier matching tier label
 * @param seqnum sequence reference
 * @param from sender
 * @param to recipients
 * @param subject subject
 * @param date date header
 * @since 0.1.0
 */
public record ExportRow(
    String messageId,
    String matched,
    String mailbox,
    String tier,
    String seqnum,
    String from,
    String to,
    String subject,
    String date) {

  /** Column names in export order. */
  public static final List<String> COLUMNS =
      List.of("message_id", "matched", "mailbox", "tier", "seqnum", "from", "to", "subject", "date");

  /**
   * Projects a result onto a row.
   *
   * @param result result to flatten
   * @return export row
   */
  public static ExportRow from(ResolutionResult result) {
    String id = result.identifier().bare();
    if (result instanceof ResolutionResult.Matched m) {
      return new ExportRow(
          id,
          "true",
          m.mailbox(),
          m.tier().label(),
          Integer.toString(m.sequenceRef()),
          m.headers().from(),
          m.headers().to(),
          m.headers().subject(),
          m.headers().date());
    }
    return new ExportRow(id, "", "", "", "", "", "", "", "");
  }

  /**
   * Returns the values in {@link #COLUMNS} order.
   *
   * @return column values
   */
  public List<String> values() {
    return List.of(messageId, matched, mailbox, tier, seqnum, from, to, subject, date);
  }
}
