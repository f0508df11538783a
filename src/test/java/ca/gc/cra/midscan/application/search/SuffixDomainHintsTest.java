package ca.gc.cra.midscan.application.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SuffixDomainHintsTest {

  @Test
  void domainsAreNormalizedAndDeduplicated() {
    SuffixDomainHints hints = new SuffixDomainHints(List.of(" @Gmail.com", "gmail.com", "", "outlook.com"));

    assertEquals(List.of("gmail.com", "outlook.com"), hints.domains());
  }

  @Test
  void firstConfiguredDomainContainedInIdentifierWins() {
    SuffixDomainHints hints = new SuffixDomainHints(List.of("outlook.com", "gmail.com"));

    assertEquals(Optional.of("gmail.com"), hints.hintFor(MessageIdentifier.parse("<123.ABC@GMAIL.COM>")));
    assertTrue(hints.hintFor(MessageIdentifier.parse("<123@example.org>")).isEmpty());
    assertTrue(SenderDomainHints.NONE.hintFor(MessageIdentifier.parse("<123@gmail.com>")).isEmpty());
  }
}
