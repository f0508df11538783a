package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.SearchQuery.HeaderQuery;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Header-search tiers run against the currently selected mailbox.
 * <p><strong>Why:</strong> Servers disagree on header spelling, delimiter handling and search syntax, so each tier
 * is a ladder of attempts that stops on the first non-empty answer.</p>
 * <p><strong>Role:</strong> Application service used by the mailbox scan orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the session it drives; not for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TieredQueryBuilder {
  private static final Logger log = LoggerFactory.getLogger(TieredQueryBuilder.class);

  /** Spellings of the canonical identifier header, in attempt order. */
  public static final List<String> IDENTIFIER_FIELDS = List.of("Message-ID", "Message-Id");
  /** Ancestry headers that may carry the identifier, in attempt order. */
  public static final List<String> REFERENCE_FIELDS = List.of("References", "In-Reply-To");

  private final SearchAttemptRunner runner;

  /**
   * Creates a builder that issues attempts through the given runner.
   *
   * @param runner attempt runner bound to the active session
   */
  public TieredQueryBuilder(SearchAttemptRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  /**
   * Lists the attempts for a header tier in the order they are issued.
   *
   * @param tier {@link SearchTier#EXACT_HEADER_MATCH} or {@link SearchTier#REFERENCE_CHAIN_MATCH}
   * @param identifier target identifier
   * @return ordered attempts: field, then bracketed/bare form, then encoding
   * @throws IllegalArgumentException for the time-window tier, which is not header based
   */
  public static List<HeaderQuery> attempts(SearchTier tier, MessageIdentifier identifier) {
    List<String> fields = switch (tier) {
      case EXACT_HEADER_MATCH -> IDENTIFIER_FIELDS;
      case REFERENCE_CHAIN_MATCH -> REFERENCE_FIELDS;
      case TIME_WINDOW_MATCH -> throw new IllegalArgumentException("time window tier has no header attempts");
    };
    List<HeaderQuery> queries = new ArrayList<>(fields.size() * 4);
    for (String field : fields) {
      for (String form : List.of(identifier.bracketed(), identifier.bare())) {
        for (SearchEncoding encoding : SearchEncoding.values()) {
          queries.add(new HeaderQuery(field, form, encoding));
        }
      }
    }
    return queries;
  }

  /**
   * Runs the exact-header tier and then the reference-chain tier.
   *
   * @param identifier target identifier
   * @return first tier that produced hits, or empty when both tiers are exhausted
   * @throws TransportException if the session is lost
   */
  public Optional<TierMatch> search(MessageIdentifier identifier) throws TransportException {
    Optional<TierMatch> exact = searchTier(SearchTier.EXACT_HEADER_MATCH, identifier);
    if (exact.isPresent()) {
      return exact;
    }
    return searchTier(SearchTier.REFERENCE_CHAIN_MATCH, identifier);
  }

  /**
   * Runs a single header tier.
   *
   * @param tier header tier to run
   * @param identifier target identifier
   * @return match for the first attempt with hits, or empty
   * @throws TransportException if the session is lost
   */
  public Optional<TierMatch> searchTier(SearchTier tier, MessageIdentifier identifier)
      throws TransportException {
    if (identifier.isEmpty()) {
      return Optional.empty();
    }
    for (HeaderQuery query : attempts(tier, identifier)) {
      AttemptOutcome outcome = runner.run(query);
      if (outcome instanceof AttemptOutcome.Hits hits) {
        log.debug("Tier {} matched via {} ({})", tier.label(), query.field(), query.encoding());
        return Optional.of(new TierMatch(tier, hits.sequenceRefs()));
      }
    }
    return Optional.empty();
  }
}
