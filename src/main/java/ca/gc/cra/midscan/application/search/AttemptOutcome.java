package ca.gc.cra.midscan.application.search;

import java.util.List;

/**
 * Result of one remote search request. Tier logic branches on this value; remote failures never escape as
 * exceptions except for transport loss.
 *
 * @since 0.1.0
 */
public sealed interface AttemptOutcome
    permits AttemptOutcome.Hits, AttemptOutcome.NoHits, AttemptOutcome.Failed {

  /** Shared empty outcome. */
  AttemptOutcome NO_HITS = new NoHits();

  /**
   * Indicates whether the request produced at least one sequence number.
   *
   * @return {@code true} only for {@link Hits}
   */
  default boolean found() {
    return this instanceof Hits;
  }

  /**
   * Non-empty result set.
   *
   * @param sequenceRefs matching sequence numbers in server order
   */
  record Hits(List<Integer> sequenceRefs) implements AttemptOutcome {
    public Hits {
      sequenceRefs = List.copyOf(sequenceRefs);
      if (sequenceRefs.isEmpty()) {
        throw new IllegalArgumentException("hits must not be empty");
      }
    }
  }

  /** Request succeeded and matched nothing. */
  record NoHits() implements AttemptOutcome {}

  /**
   * Request failed or its response was unusable; the caller moves on to the next attempt.
   *
   * @param reason failure description for logs
   */
  record Failed(String reason) implements AttemptOutcome {}
}
