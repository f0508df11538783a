package ca.gc.cra.midscan.domain.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MessageIdentifierTest {

  @Test
  void bracketedAndBareInputsNormalizeToTheSameValue() {
    MessageIdentifier bracketed = MessageIdentifier.parse("  <abc.123@example.com>  ");
    MessageIdentifier bare = MessageIdentifier.parse("abc.123@example.com");

    assertEquals("abc.123@example.com", bracketed.bare());
    assertEquals("<abc.123@example.com>", bracketed.bracketed());
    assertEquals(bare, bracketed);
    assertEquals(bare.hashCode(), bracketed.hashCode());
  }

  @Test
  void strayDelimitersAreDropped() {
    assertEquals("abc@example.com", MessageIdentifier.parse("<abc@example.com").bare());
    assertEquals("abc@example.com", MessageIdentifier.parse("abc@example.com>").bare());
    assertEquals("abc@example.com", MessageIdentifier.parse("<<abc@example.com>>").bare());
  }

  @Test
  void blankAndNullInputsAreEmpty() {
    assertTrue(MessageIdentifier.parse(null).isEmpty());
    assertTrue(MessageIdentifier.parse("   ").isEmpty());
    assertTrue(MessageIdentifier.parse("<>").isEmpty());
  }

  @Test
  void appearsInMatchesEitherForm() {
    MessageIdentifier id = MessageIdentifier.parse("abc@example.com");

    assertTrue(id.appearsIn("Message-ID: <abc@example.com>\r\n"));
    assertTrue(id.appearsIn("Message-ID: abc@example.com\r\n"));
    assertFalse(id.appearsIn("Message-ID: <other@example.com>\r\n"));
    assertFalse(id.appearsIn(null));
    assertFalse(MessageIdentifier.parse("").appearsIn("anything"));
  }
}
