package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.SearchQuery.DateWindowQuery;
import ca.gc.cra.midscan.domain.message.EmbeddedTimestamp;
import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Time-window tier: searches a three-day delivery window around the identifier's embedded
 * timestamp and verifies candidates by reading their {@code Message-ID} header.
 * <p><strong>Why:</strong> Some servers rewrite or strip the delimited identifier so header search misses it, while
 * the literal text still survives in the stored header.</p>
 * <p><strong>Role:</strong> Last tier run by the mailbox scan orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Not for concurrent use; drives the shared session selection.</p>
 *
 * @since 0.1.0
 */
public final class CandidateWindowScanner {
  private static final Logger log = LoggerFactory.getLogger(CandidateWindowScanner.class);

  /** Headers fetched when filtering candidates by sender or reporting a match. */
  public static final List<String> REPORT_FIELDS = List.of("FROM", "TO", "SUBJECT", "DATE", "MESSAGE-ID");
  /** Headers fetched when verifying a candidate. */
  public static final List<String> IDENTIFIER_FIELDS = List.of("MESSAGE-ID");

  private final MailSessionPort session;
  private final SearchAttemptRunner runner;

  /**
   * Creates a scanner.
   *
   * @param session session used for header fetches
   * @param runner runner used for the window search
   */
  public CandidateWindowScanner(MailSessionPort session, SearchAttemptRunner runner) {
    this.session = Objects.requireNonNull(session, "session");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  /**
   * Builds the window search for a timestamp: one calendar day either side.
   *
   * @param timestamp embedded timestamp
   * @return date window query
   */
  public static DateWindowQuery windowAround(LocalDateTime timestamp) {
    LocalDate day = timestamp.toLocalDate();
    return new DateWindowQuery(day.minusDays(1), day.plusDays(1));
  }

  /**
   * Runs the tier for one identifier in the selected mailbox.
   *
   * @param identifier target identifier
   * @param senderHint optional lower-case sender-domain fragment
   * @return match carrying the verified sequence number, or empty
   * @throws TransportException if the session is lost
   */
  public Optional<TierMatch> scan(MessageIdentifier identifier, Optional<String> senderHint)
      throws TransportException {
    if (identifier.isEmpty()) {
      return Optional.empty();
    }
    Optional<LocalDateTime> timestamp = EmbeddedTimestamp.extract(identifier);
    if (timestamp.isEmpty()) {
      log.debug("No embedded timestamp in {}; time window tier skipped", identifier);
      return Optional.empty();
    }
    AttemptOutcome outcome = runner.run(windowAround(timestamp.get()));
    if (!(outcome instanceof AttemptOutcome.Hits hits)) {
      return Optional.empty();
    }
    List<Integer> candidates = hits.sequenceRefs();
    if (senderHint.isPresent()) {
      candidates = narrowBySender(candidates, senderHint.get());
    }
    log.debug("Verifying {} time window candidate(s)", candidates.size());
    for (int seq : candidates) {
      String raw;
      try {
        raw = session.fetchHeaders(seq, IDENTIFIER_FIELDS);
      } catch (SearchException ex) {
        log.debug("Skipping candidate {}: {}", seq, ex.getMessage());
        continue;
      }
      if (identifier.appearsIn(raw)) {
        return Optional.of(new TierMatch(SearchTier.TIME_WINDOW_MATCH, List.of(seq)));
      }
    }
    return Optional.empty();
  }

  private List<Integer> narrowBySender(List<Integer> candidates, String hint) throws TransportException {
    String needle = hint.toLowerCase(Locale.ROOT);
    List<Integer> kept = new ArrayList<>();
    for (int seq : candidates) {
      try {
        HeaderSnapshot headers = HeaderSnapshot.parse(session.fetchHeaders(seq, REPORT_FIELDS));
        if (headers.from().toLowerCase(Locale.ROOT).contains(needle)) {
          kept.add(seq);
        }
      } catch (SearchException ex) {
        log.debug("Dropping candidate {} from sender filter: {}", seq, ex.getMessage());
      }
    }
    if (kept.isEmpty()) {
      log.debug("Sender hint '{}' matched no candidates; using all {}", hint, candidates.size());
      return candidates;
    }
    return kept;
  }
}
