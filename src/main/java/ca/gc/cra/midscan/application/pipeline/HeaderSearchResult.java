package ca.gc.cra.midscan.application.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a header search in one mailbox.
 *
 * @param mailbox searched mailbox
 * @param totalHits number of messages the server matched
 * @param hits listed messages, oldest first; at most the requested limit
 * @since 0.1.0
 */
public record HeaderSearchResult(String mailbox, int totalHits, List<HeaderSearchHit> hits) {

  public HeaderSearchResult {
    Objects.requireNonNull(mailbox, "mailbox");
    hits = List.copyOf(Objects.requireNonNullElse(hits, List.of()));
  }

  /**
   * Indicates whether older matches were left out because of the limit.
   *
   * @return {@code true} when fewer messages were listed than matched
   */
  public boolean truncated() {
    return hits.size() < totalHits;
  }
}
