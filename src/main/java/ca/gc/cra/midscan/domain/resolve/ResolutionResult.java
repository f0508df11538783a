package ca.gc.cra.midscan.domain.resolve;

import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.util.Objects;

/**
 * <strong>What:</strong> Terminal outcome of resolving one identifier.
 * <p><strong>Why:</strong> A closed type makes it impossible to read a sequence reference or header snapshot from a
 * negative outcome.</p>
 * <p><strong>Role:</strong> Domain value produced by the aggregator and consumed by export adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface ResolutionResult permits ResolutionResult.Matched, ResolutionResult.NotFound {

  /**
   * Returns the identifier that was resolved.
   *
   * @return normalized identifier
   */
  MessageIdentifier identifier();

  /**
   * Indicates whether a mailbox containing the message was found.
   *
   * @return {@code true} for {@link Matched}
   */
  boolean matched();

  /**
   * Positive outcome naming exactly one mailbox and one tier.
   *
   * @param identifier resolved identifier
   * @param mailbox mailbox that was selected when the match was found
   * @param tier tier that produced the match
   * @param sequenceRef server sequence number, valid only for the selection that produced it
   * @param headers header snapshot of the matched message
   */
  record Matched(
      MessageIdentifier identifier,
      String mailbox,
      SearchTier tier,
      int sequenceRef,
      HeaderSnapshot headers) implements ResolutionResult {

    /**
     * Validates required components.
     */
    public Matched {
      Objects.requireNonNull(identifier, "identifier");
      Objects.requireNonNull(mailbox, "mailbox");
      Objects.requireNonNull(tier, "tier");
      if (sequenceRef <= 0) {
        throw new IllegalArgumentException("sequenceRef must be positive (was " + sequenceRef + ")");
      }
      headers = headers == null ? HeaderSnapshot.empty() : headers;
    }

    @Override
    public boolean matched() {
      return true;
    }
  }

  /**
   * Negative outcome reached when the scan plan is exhausted.
   *
   * @param identifier identifier that was not found
   */
  record NotFound(MessageIdentifier identifier) implements ResolutionResult {

    /**
     * Validates the identifier.
     */
    public NotFound {
      Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public boolean matched() {
      return false;
    }
  }
}
