package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.MetricsPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.SelectionException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.CandidateWindowScanner;
import ca.gc.cra.midscan.application.search.SenderDomainHints;
import ca.gc.cra.midscan.application.search.TierMatch;
import ca.gc.cra.midscan.application.search.TieredQueryBuilder;
import ca.gc.cra.midscan.domain.mailbox.ScanPlan;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Visits the mailboxes of a {@link ScanPlan} one at a time and runs the search tiers in each.
 * <p><strong>Why:</strong> A message may have been filed, moved or deleted anywhere in the account; the first
 * mailbox in plan order that yields a match is the answer.</p>
 * <p><strong>Role:</strong> Application service between the batch use case and the tier implementations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select each planned mailbox read-only, skipping those that cannot be selected.</li>
 *   <li>Run exact-header, reference-chain and time-window tiers in that order.</li>
 *   <li>Stop at the first match and capture its report headers before the selection changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owns the session selection while running.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code mailbox} per visit; emits {@code resolve.mailbox.*}.</p>
 *
 * @since 0.1.0
 */
public final class MailboxScanOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(MailboxScanOrchestrator.class);

  private final MailSessionPort session;
  private final TieredQueryBuilder headerTiers;
  private final CandidateWindowScanner windowScanner;
  private final SenderDomainHints hints;
  private final MetricsPort metrics;

  /**
   * Creates an orchestrator.
   *
   * @param session session whose selection is driven; must not be {@code null}
   * @param headerTiers exact-header and reference-chain tiers; must not be {@code null}
   * @param windowScanner time-window tier; must not be {@code null}
   * @param hints sender-domain hint strategy; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public MailboxScanOrchestrator(
      MailSessionPort session,
      TieredQueryBuilder headerTiers,
      CandidateWindowScanner windowScanner,
      SenderDomainHints hints,
      MetricsPort metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.headerTiers = Objects.requireNonNull(headerTiers, "headerTiers");
    this.windowScanner = Objects.requireNonNull(windowScanner, "windowScanner");
    this.hints = Objects.requireNonNull(hints, "hints");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Scans the plan for one identifier.
   *
   * @param identifier target identifier
   * @param plan mailboxes in visit order
   * @return the first hit in plan order, or empty once the plan is exhausted
   * @throws TransportException if the session is lost; remaining mailboxes are not visited
   */
  public Optional<MailboxHit> scan(MessageIdentifier identifier, ScanPlan plan) throws TransportException {
    if (identifier.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> hint = hints.hintFor(identifier);
    hint.ifPresent(h -> log.debug("Sender hint for {}: {}", identifier, h));
    for (String mailbox : plan) {
      String previousMailbox = MDC.get("mailbox");
      MDC.put("mailbox", mailbox);
      try {
        Optional<MailboxHit> hit = visit(mailbox, identifier, hint);
        if (hit.isPresent()) {
          return hit;
        }
      } finally {
        if (previousMailbox == null) {
          MDC.remove("mailbox");
        } else {
          MDC.put("mailbox", previousMailbox);
        }
      }
    }
    log.debug("Plan exhausted for {} after {} mailbox(es)", identifier, plan.size());
    return Optional.empty();
  }

  private Optional<MailboxHit> visit(String mailbox, MessageIdentifier identifier, Optional<String> hint)
      throws TransportException {
    try {
      session.selectReadOnly(mailbox);
    } catch (SelectionException ex) {
      metrics.increment("resolve.mailbox.selectFailed");
      log.warn("Skipping mailbox {}: {}", mailbox, ex.getMessage());
      return Optional.empty();
    }
    metrics.increment("resolve.mailbox.selected");

    Optional<TierMatch> match = headerTiers.search(identifier);
    if (match.isEmpty()) {
      match = windowScanner.scan(identifier, hint);
    }
    if (match.isEmpty()) {
      return Optional.empty();
    }
    TierMatch tierMatch = match.get();
    log.info("Found {} in {} (tier {}, seq {})",
        identifier, mailbox, tierMatch.tier().label(), tierMatch.firstSequenceRef());
    return Optional.of(new MailboxHit(mailbox, tierMatch, reportHeaders(tierMatch.firstSequenceRef())));
  }

  private String reportHeaders(int sequenceRef) throws TransportException {
    try {
      return session.fetchHeaders(sequenceRef, CandidateWindowScanner.REPORT_FIELDS);
    } catch (SearchException ex) {
      log.warn("Could not fetch report headers for seq {}: {}", sequenceRef, ex.getMessage());
      return "";
    }
  }
}
