package ca.gc.cra.midscan.application.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.application.search.SearchQuery.DateWindowQuery;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import ca.gc.cra.midscan.testutil.RecordingMetricsPort;
import ca.gc.cra.midscan.testutil.ScriptedMailSession;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CandidateWindowScannerTest {
  private static final MessageIdentifier ID =
      MessageIdentifier.parse("<20240213212126.4429A161827048B0@gmail.com>");
  private static final LocalDate DAY = LocalDate.of(2024, 2, 13);

  private ScriptedMailSession session;
  private CandidateWindowScanner scanner;

  @BeforeEach
  void setUp() {
    session = new ScriptedMailSession();
    scanner = new CandidateWindowScanner(session, new SearchAttemptRunner(session, new RecordingMetricsPort()));
  }

  @Test
  void windowSpansOneDayEitherSide() {
    DateWindowQuery window = CandidateWindowScanner.windowAround(LocalDateTime.of(2024, 2, 13, 21, 21, 26));

    assertEquals(LocalDate.of(2024, 2, 12), window.since());
    assertEquals(LocalDate.of(2024, 2, 14), window.until());
  }

  @Test
  void verifiesCandidatesAndReturnsTheMatchingSequence() throws Exception {
    session.mailbox("INBOX")
        .message(DAY.minusDays(5), "Message-ID", "<old@gmail.com>")
        .message(DAY, "Message-ID", "<unrelated@gmail.com>")
        .message(DAY.minusDays(1), "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>");
    session.selectReadOnly("INBOX");

    Optional<TierMatch> match = scanner.scan(ID, Optional.empty());

    assertEquals(SearchTier.TIME_WINDOW_MATCH, match.orElseThrow().tier());
    assertEquals(List.of(3), match.get().sequenceRefs());
    assertEquals(List.of("search:SEARCH SINCE 12-Feb-2024 BEFORE 15-Feb-2024"), session.calls("search:"));
    assertEquals(List.of("fetchHeaders:2", "fetchHeaders:3"), session.calls("fetchHeaders:"));
  }

  @Test
  void messageDeliveredOnTheLastDayOfTheWindowIsFound() throws Exception {
    session.mailbox("INBOX")
        .message(DAY.plusDays(2), "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>")
        .message(DAY.plusDays(1), "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>");
    session.selectReadOnly("INBOX");

    Optional<TierMatch> match = scanner.scan(ID, Optional.empty());

    assertEquals(List.of(2), match.orElseThrow().sequenceRefs());
    assertEquals(List.of("fetchHeaders:2"), session.calls("fetchHeaders:"));
  }

  @Test
  void senderHintNarrowsCandidatesBeforeVerification() throws Exception {
    session.mailbox("INBOX")
        .message(DAY, "From", "someone@other.org", "Message-ID", "<x@other.org>")
        .message(DAY, "From", "Sender <me@GMAIL.com>",
            "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>");
    session.selectReadOnly("INBOX");

    Optional<TierMatch> match = scanner.scan(ID, Optional.of("gmail.com"));

    assertEquals(2, match.orElseThrow().firstSequenceRef());
    // two sender fetches, then a single verification fetch for the surviving candidate
    assertEquals(List.of("fetchHeaders:1", "fetchHeaders:2", "fetchHeaders:2"), session.calls("fetchHeaders:"));
  }

  @Test
  void hintMatchingNothingFallsBackToAllCandidates() throws Exception {
    session.mailbox("INBOX")
        .message(DAY, "From", "a@other.org", "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>");
    session.selectReadOnly("INBOX");

    Optional<TierMatch> match = scanner.scan(ID, Optional.of("example.net"));

    assertEquals(1, match.orElseThrow().firstSequenceRef());
  }

  @Test
  void failedCandidateFetchIsSkipped() throws Exception {
    session.mailbox("INBOX")
        .message(DAY, "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>")
        .message(DAY, "Message-ID", "<20240213212126.4429A161827048B0@gmail.com>");
    session.failFetch(1).selectReadOnly("INBOX");

    Optional<TierMatch> match = scanner.scan(ID, Optional.empty());

    assertEquals(2, match.orElseThrow().firstSequenceRef());
  }

  @Test
  void identifierWithoutTimestampIssuesNoSearch() throws Exception {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<CAB123@mail.gmail.com>");
    session.selectReadOnly("INBOX");

    assertTrue(scanner.scan(MessageIdentifier.parse("CAB123@mail.gmail.com"), Optional.empty()).isEmpty());
    assertTrue(session.calls("search:").isEmpty());
  }

  @Test
  void noVerifiedCandidateYieldsEmpty() throws Exception {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<different@gmail.com>");
    session.selectReadOnly("INBOX");

    assertTrue(scanner.scan(ID, Optional.empty()).isEmpty());
  }
}
