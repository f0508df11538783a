package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.domain.resolve.SearchTier;
import java.util.List;
import java.util.Objects;

/**
 * Positive result of one tier inside the currently selected mailbox.
 *
 * @param tier tier that matched
 * @param sequenceRefs matching sequence numbers; never empty
 * @since 0.1.0
 */
public record TierMatch(SearchTier tier, List<Integer> sequenceRefs) {

  public TierMatch {
    Objects.requireNonNull(tier, "tier");
    sequenceRefs = List.copyOf(sequenceRefs);
    if (sequenceRefs.isEmpty()) {
      throw new IllegalArgumentException("a tier match needs at least one sequence reference");
    }
  }

  /**
   * Returns the sequence number reported for the match (the first hit in server order).
   *
   * @return sequence number
   */
  public int firstSequenceRef() {
    return sequenceRefs.get(0);
  }
}
