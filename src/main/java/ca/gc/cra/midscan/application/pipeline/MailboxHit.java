package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.search.TierMatch;
import java.util.Objects;

/**
 * Terminal positive state of a mailbox scan: where the identifier was found and the raw report headers fetched
 * while that mailbox was still selected.
 *
 * @param mailbox matching mailbox
 * @param match tier and sequence numbers
 * @param rawHeaders raw {@code FROM TO SUBJECT DATE MESSAGE-ID} block; empty when the fetch failed
 * @since 0.1.0
 */
public record MailboxHit(String mailbox, TierMatch match, String rawHeaders) {

  public MailboxHit {
    Objects.requireNonNull(mailbox, "mailbox");
    Objects.requireNonNull(match, "match");
    rawHeaders = rawHeaders == null ? "" : rawHeaders;
  }
}
