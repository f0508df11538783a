package ca.gc.cra.midscan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.application.port.TransportException;
import ca.gc.cra.midscan.application.search.CandidateWindowScanner;
import ca.gc.cra.midscan.application.search.SearchAttemptRunner;
import ca.gc.cra.midscan.application.search.SenderDomainHints;
import ca.gc.cra.midscan.application.search.TieredQueryBuilder;
import ca.gc.cra.midscan.domain.mailbox.ScanPlan;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import ca.gc.cra.midscan.testutil.RecordingMetricsPort;
import ca.gc.cra.midscan.testutil.ScriptedMailSession;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MailboxScanOrchestratorTest {
  private static final MessageIdentifier ID = MessageIdentifier.parse("<abc@example.com>");
  private static final LocalDate DAY = LocalDate.of(2024, 2, 13);

  private ScriptedMailSession session;
  private RecordingMetricsPort metrics;
  private MailboxScanOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    session = new ScriptedMailSession();
    metrics = new RecordingMetricsPort();
    SearchAttemptRunner runner = new SearchAttemptRunner(session, metrics);
    orchestrator = new MailboxScanOrchestrator(
        session,
        new TieredQueryBuilder(runner),
        new CandidateWindowScanner(session, runner),
        SenderDomainHints.NONE,
        metrics);
  }

  @Test
  void visitsMailboxesInPlanOrderAndStopsAtFirstHit() throws Exception {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<other@example.com>");
    session.mailbox("Trash").message(DAY, "Message-ID", "<abc@example.com>", "Subject", "found me");
    session.mailbox("Archive").message(DAY, "Message-ID", "<abc@example.com>");

    Optional<MailboxHit> hit = orchestrator.scan(ID, ScanPlan.of("INBOX", "Trash", "Archive"));

    assertEquals("Trash", hit.orElseThrow().mailbox());
    assertEquals(SearchTier.EXACT_HEADER_MATCH, hit.get().match().tier());
    assertTrue(hit.get().rawHeaders().contains("Subject: found me"));
    assertEquals(List.of("select:INBOX", "select:Trash"), session.calls("select:"));
    assertEquals(2, metrics.count("resolve.mailbox.selected"));
    assertNull(MDC.get("mailbox"));
  }

  @Test
  void laterMailboxIsReachedAfterEarlierOnesAreSearched() throws Exception {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<other@example.com>");
    session.mailbox("Trash").message(DAY, "Message-ID", "<unrelated@example.com>");
    session.mailbox("Archive").message(DAY, "Message-ID", "<abc@example.com>");

    Optional<MailboxHit> hit = orchestrator.scan(ID, ScanPlan.of("INBOX", "Trash", "Archive"));

    assertEquals("Archive", hit.orElseThrow().mailbox());
    assertEquals(SearchTier.EXACT_HEADER_MATCH, hit.get().match().tier());
    List<String> calls = session.calls();
    int trashSelect = calls.indexOf("select:Trash");
    int archiveSelect = calls.indexOf("select:Archive");
    assertTrue(calls.indexOf("select:INBOX") < trashSelect);
    assertTrue(trashSelect < archiveSelect);
    // every header query ran against Trash before Archive was selected
    assertEquals(16, calls.subList(trashSelect, archiveSelect).stream()
        .filter(call -> call.startsWith("search:")).count());
    assertTrue(calls.subList(archiveSelect, calls.size()).stream().anyMatch(call -> call.startsWith("search:")));
  }

  @Test
  void identifierWithLineBreakFailsQuotedQueriesWithoutAbortingTheScan() throws Exception {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<other@example.com>");
    session.mailbox("Trash").message(DAY, "Message-ID", "<other@example.com>");

    Optional<MailboxHit> hit = orchestrator.scan(MessageIdentifier.parse("a\nb@x"), ScanPlan.of("INBOX", "Trash"));

    assertTrue(hit.isEmpty());
    assertEquals(List.of("select:INBOX", "select:Trash"), session.calls("select:"));
    assertTrue(metrics.count("resolve.search.failures") > 0);
  }

  @Test
  void refusedSelectionIsSkipped() throws Exception {
    session.mailbox("INBOX");
    session.mailbox("Archive").message(DAY, "Message-ID", "<abc@example.com>");
    session.refuseSelect("INBOX");

    Optional<MailboxHit> hit = orchestrator.scan(ID, ScanPlan.of("INBOX", "Archive"));

    assertEquals("Archive", hit.orElseThrow().mailbox());
    assertEquals(1, metrics.count("resolve.mailbox.selectFailed"));
    // nothing is searched while the refused mailbox would have been active
    assertEquals("select:Archive", session.calls().get(1));
  }

  @Test
  void exactMatchSkipsLaterTiers() throws Exception {
    MessageIdentifier timestamped = MessageIdentifier.parse("<20240213212126.X@example.com>");
    session.mailbox("INBOX").message(DAY, "Message-ID", "<20240213212126.X@example.com>");

    Optional<MailboxHit> hit = orchestrator.scan(timestamped, ScanPlan.of("INBOX"));

    assertEquals(SearchTier.EXACT_HEADER_MATCH, hit.orElseThrow().match().tier());
    assertFalse(session.calls("search:").stream().anyMatch(call -> call.contains("SINCE")));
  }

  @Test
  void timeWindowTierRunsAfterHeaderTiersInTheSameMailbox() throws Exception {
    MessageIdentifier timestamped = MessageIdentifier.parse("<20240213212126.X@example.com>");
    // the server cannot search this header, but the fetched header block still carries the identifier
    session.mailbox("INBOX").message(DAY, "X-Original-Message-ID", "<20240213212126.X@example.com>");
    session.mailbox("Trash");

    Optional<MailboxHit> hit = orchestrator.scan(timestamped, ScanPlan.of("INBOX", "Trash"));

    assertTrue(hit.isEmpty(), "Message-ID fetch returns nothing for this message");
    List<String> searches = session.calls("search:");
    assertEquals(17 * 2, searches.size());
    assertTrue(searches.get(16).contains("SINCE 12-Feb-2024 BEFORE 15-Feb-2024"));
  }

  @Test
  void exhaustedPlanReturnsEmpty() throws Exception {
    session.mailbox("INBOX");

    assertTrue(orchestrator.scan(ID, ScanPlan.of("INBOX")).isEmpty());
    assertTrue(orchestrator.scan(MessageIdentifier.parse(""), ScanPlan.of("INBOX")).isEmpty());
  }

  @Test
  void transportFailureAbortsRemainingMailboxes() {
    session.mailbox("INBOX");
    session.mailbox("Trash").message(DAY, "Message-ID", "<abc@example.com>");
    session.dropConnectionOnSelect("INBOX");

    assertThrows(TransportException.class, () -> orchestrator.scan(ID, ScanPlan.of("INBOX", "Trash")));
    assertEquals(List.of("select:INBOX"), session.calls("select:"));
    assertNull(MDC.get("mailbox"));
  }
}
