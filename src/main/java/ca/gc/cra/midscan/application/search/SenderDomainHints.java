package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.util.Optional;

/**
 * Derives an optional sender-domain hint used to narrow time-window candidates.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SenderDomainHints {

  /**
   * Returns the hint for an identifier.
   *
   * @param identifier target identifier
   * @return lower-case domain fragment, or empty when no hint applies
   */
  Optional<String> hintFor(MessageIdentifier identifier);

  /** Strategy that never produces a hint. */
  SenderDomainHints NONE = identifier -> Optional.empty();
}
