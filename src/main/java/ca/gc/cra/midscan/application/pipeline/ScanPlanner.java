package ca.gc.cra.midscan.application.pipeline;

import ca.gc.cra.midscan.application.port.MailSessionPort;
import ca.gc.cra.midscan.application.port.SearchException;
import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.domain.mailbox.MailboxDescriptor;
import ca.gc.cra.midscan.domain.mailbox.MailboxSource;
import ca.gc.cra.midscan.domain.mailbox.ScanPlan;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the per-identifier {@link ScanPlan}: the start mailbox, then the conventional priority mailboxes that are
 * candidates, then the remaining candidates.
 *
 * <p>Server enumeration happens at most once per planner; plans are rebuilt for every identifier so they start from
 * whichever mailbox the session currently has selected.</p>
 *
 * @since 0.1.0
 */
public final class ScanPlanner {
  private static final Logger log = LoggerFactory.getLogger(ScanPlanner.class);

  /** Conventionally important mailboxes in priority order. */
  public static final List<String> DEFAULT_MAILBOXES = List.of(
      "INBOX",
      "Trash",
      "Junk",
      "Spam",
      "Sent",
      "Drafts",
      "Archive",
      "[Gmail]/All Mail",
      "[Gmail]/Trash",
      "[Gmail]/Spam",
      "[Gmail]/Sent Mail",
      "[Gmail]/Drafts");

  /** Start mailbox used when none is configured and the session has no active selection. */
  public static final String DEFAULT_START = "INBOX";

  private final MailboxSource source;
  private final List<String> explicitMailboxes;
  private final String startMailbox;

  private List<String> candidates;
  private Set<String> excluded;

  /**
   * Creates a planner.
   *
   * @param source where candidate names come from
   * @param explicitMailboxes names used when {@code source} is {@link MailboxSource#EXPLICIT}
   * @param startMailbox fixed start mailbox, or {@code null} to follow the session's active mailbox
   */
  public ScanPlanner(MailboxSource source, List<String> explicitMailboxes, String startMailbox) {
    this.source = Objects.requireNonNull(source, "source");
    this.explicitMailboxes = List.copyOf(Objects.requireNonNull(explicitMailboxes, "explicitMailboxes"));
    this.startMailbox = startMailbox == null || startMailbox.isBlank() ? null : startMailbox.trim();
    if (source == MailboxSource.EXPLICIT && this.explicitMailboxes.isEmpty()) {
      throw new IllegalArgumentException("explicit mailbox source requires at least one mailbox");
    }
  }

  /**
   * Builds the plan for the next identifier.
   *
   * @param session session consulted for enumeration and the active mailbox
   * @return ordered, duplicate-free plan
   * @throws TransportException if enumeration loses the connection
   */
  public ScanPlan plan(MailSessionPort session) throws TransportException {
    if (candidates == null) {
      loadCandidates(session);
    }
    String start = startMailbox != null
        ? startMailbox
        : session.activeMailbox().orElse(DEFAULT_START);
    List<String> priority = new ArrayList<>(DEFAULT_MAILBOXES);
    priority.remove(start);
    ScanPlan plan = ScanPlan.build(start, priority, candidates, excluded);
    log.debug("Scan plan {}", plan);
    return plan;
  }

  private void loadCandidates(MailSessionPort session) throws TransportException {
    excluded = Set.of();
    switch (source) {
      case DEFAULT -> candidates = DEFAULT_MAILBOXES;
      case EXPLICIT -> candidates = explicitMailboxes;
      case ALL -> loadFromServer(session);
    }
  }

  private void loadFromServer(MailSessionPort session) throws TransportException {
    List<MailboxDescriptor> listed;
    try {
      listed = session.listMailboxes();
    } catch (SearchException ex) {
      log.warn("Mailbox enumeration failed ({}); using default mailbox list", ex.getMessage());
      candidates = DEFAULT_MAILBOXES;
      return;
    }
    List<String> selectable = new ArrayList<>();
    Set<String> noSelect = new HashSet<>();
    for (MailboxDescriptor descriptor : listed) {
      if (descriptor.selectable()) {
        selectable.add(descriptor.name());
      } else {
        noSelect.add(descriptor.name());
      }
    }
    excluded = Set.copyOf(noSelect);
    if (selectable.isEmpty()) {
      log.warn("Server enumerated no selectable mailboxes; using default mailbox list");
      candidates = DEFAULT_MAILBOXES;
      return;
    }
    log.info("Enumerated {} selectable mailbox(es), {} not selectable", selectable.size(), noSelect.size());
    candidates = List.copyOf(selectable);
  }
}
