package ca.gc.cra.midscan.domain.resolve;

import java.util.Locale;

/**
 * <strong>What:</strong> Matching strategies in the order they are tried inside one mailbox.
 * <p><strong>Role:</strong> Domain enumeration recorded on every positive result and used as a metric dimension.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SearchTier {
  /** Header search on {@code Message-ID} (both spellings, both delimiter forms). */
  EXACT_HEADER_MATCH,
  /** Header search on {@code References} and {@code In-Reply-To}. */
  REFERENCE_CHAIN_MATCH,
  /** Date-window scan around an embedded timestamp, verified by header inspection. */
  TIME_WINDOW_MATCH;

  /**
   * Returns the lower-case label used in exports and metric names.
   *
   * @return label such as {@code exact_header_match}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
