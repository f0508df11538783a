package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import java.util.Objects;

/**
 * One message listed by a header search.
 *
 * @param sequenceRef sequence number in the searched mailbox
 * @param headers decoded report headers
 * @since 0.1.0
 */
public record HeaderSearchHit(int sequenceRef, HeaderSnapshot headers) {

  public HeaderSearchHit {
    Objects.requireNonNull(headers, "headers");
  }
}
