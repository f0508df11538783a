package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.port.HeaderDecoder;
import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.SelectionException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.AttemptOutcome;
import ca.gc.cra.midscan.application.search.CandidateWindowScanner;
import ca.gc.cra.midscan.application.search.HeaderSearchField;
import ca.gc.cra.midscan.application.search.SearchAttemptRunner;
import ca.gc.cra.midscan.application.search.SearchEncoding;
import ca.gc.cra.midscan.application.search.SearchQuery.HeaderQuery;
import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the messages of one mailbox whose sender or subject header contains a value.
 *
 * <p>The query is tried with each {@link SearchEncoding} until one returns hits. Only the newest {@code limit}
 * matches (highest sequence numbers) have their headers fetched.</p>
 *
 * @since 0.1.0
 */
public final class HeaderSearchUseCase {
  private static final Logger log = LoggerFactory.getLogger(HeaderSearchUseCase.class);

  private final MailSessionPort session;
  private final SearchAttemptRunner runner;
  private final HeaderDecoder decoder;

  /**
   * Creates the use case.
   *
   * @param session authenticated session
   * @param runner search runner bound to the same session
   * @param decoder decoder applied to listed header values
   */
  public HeaderSearchUseCase(MailSessionPort session, SearchAttemptRunner runner, HeaderDecoder decoder) {
    this.session = Objects.requireNonNull(session, "session");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  /**
   * Selects {@code mailbox} read-only and lists matching messages.
   *
   * @param mailbox mailbox to search
   * @param field header to match
   * @param value text the header must contain
   * @param limit maximum number of messages to list; must be positive
   * @return matches, oldest listed first
   * @throws SelectionException if the mailbox cannot be selected
   * @throws TransportException if the session is lost
   */
  public HeaderSearchResult run(String mailbox, HeaderSearchField field, String value, int limit)
      throws SelectionException, TransportException {
    Objects.requireNonNull(mailbox, "mailbox");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    session.selectReadOnly(mailbox);

    List<Integer> matches = List.of();
    for (SearchEncoding encoding : SearchEncoding.values()) {
      AttemptOutcome outcome = runner.run(new HeaderQuery(field.headerName(), value, encoding));
      if (outcome instanceof AttemptOutcome.Hits hits) {
        matches = hits.sequenceRefs();
        break;
      }
    }
    log.info("{} message(s) in {} with {} containing '{}'", matches.size(), mailbox, field.headerName(), value);

    List<Integer> listed = matches.subList(Math.max(0, matches.size() - limit), matches.size());
    List<HeaderSearchHit> hits = new ArrayList<>(listed.size());
    for (int seq : listed) {
      try {
        String raw = session.fetchHeaders(seq, CandidateWindowScanner.REPORT_FIELDS);
        hits.add(new HeaderSearchHit(seq, HeaderSnapshot.parse(raw).decode(decoder)));
      } catch (SearchException ex) {
        log.warn("Skipping message {} in {}: {}", seq, mailbox, ex.getMessage());
      }
    }
    return new HeaderSearchResult(mailbox, matches.size(), hits);
  }
}
