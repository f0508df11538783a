package ca.gc.cra.midscan.infrastructure.imap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.application.port.TransportException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JakartaMailSessionAdapterTest {

  @Test
  void searchResponseIsCopiedIntoSequenceRefs() {
    List<Object> raw = new ArrayList<>(List.of(3, 9, 12));

    List<Integer> hits = JakartaMailSessionAdapter.sequenceRefs(raw);
    raw.clear();

    assertEquals(List.of(3, 9, 12), hits);
  }

  @Test
  void missingSearchResponseYieldsNoHits() {
    assertTrue(JakartaMailSessionAdapter.sequenceRefs(null).isEmpty());
  }

  @Test
  void operationsBeforeLoginReportLostTransport() {
    JakartaMailSessionAdapter adapter = new JakartaMailSessionAdapter(
        new ImapConnectionSettings("localhost", 993, true, Duration.ofSeconds(1)));

    assertThrows(TransportException.class, adapter::listMailboxes);
    assertThrows(TransportException.class, () -> adapter.selectReadOnly("INBOX"));
    assertTrue(adapter.activeMailbox().isEmpty());
    adapter.close();
  }
}
