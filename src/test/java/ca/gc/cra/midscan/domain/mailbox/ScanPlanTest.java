package ca.gc.cra.midscan.domain.mailbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ScanPlanTest {

  @Test
  void orderIsStartThenPriorityThenRemainingCandidates() {
    ScanPlan plan = ScanPlan.build(
        "INBOX",
        List.of("Trash", "Junk", "Archive"),
        List.of("Work", "Archive", "INBOX", "Trash"),
        Set.of());

    assertEquals(List.of("INBOX", "Trash", "Archive", "Work"), plan.mailboxes());
  }

  @Test
  void excludedNamesNeverAppearEvenAsStart() {
    ScanPlan plan = ScanPlan.build(
        "[Gmail]",
        List.of("Trash"),
        List.of("[Gmail]", "Trash", "Notes"),
        Set.of("[Gmail]", "Notes"));

    assertEquals(List.of("Trash"), plan.mailboxes());
  }

  @Test
  void startIsKeptWhenNotACandidate() {
    ScanPlan plan = ScanPlan.build("Custom", List.of("Trash"), List.of("Trash"), Set.of());

    assertEquals(List.of("Custom", "Trash"), plan.mailboxes());
  }

  @Test
  void ofDropsDuplicatesAndEmptyPlansReportEmpty() {
    assertEquals(List.of("A", "B"), ScanPlan.of("A", "B", "A").mailboxes());
    assertTrue(ScanPlan.build(null, List.of(), List.of(), Set.of()).isEmpty());
  }
}
