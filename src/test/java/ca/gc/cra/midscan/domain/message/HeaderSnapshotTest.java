package ca.gc.cra.midscan.domain.message;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class HeaderSnapshotTest {

  @Test
  void parsesFieldsCaseInsensitivelyAndUnfoldsContinuations() {
    String raw = "from: Alice <alice@example.com>\r\n"
        + "SUBJECT: Quarterly\r\n"
        + "\treport\r\n"
        + "Date: Tue, 13 Feb 2024 21:21:26 +0000\r\n"
        + "Message-Id: <abc@example.com>\r\n"
        + "\r\n";

    HeaderSnapshot snapshot = HeaderSnapshot.parse(raw);

    assertEquals("Alice <alice@example.com>", snapshot.from());
    assertEquals("", snapshot.to());
    assertEquals("Quarterly report", snapshot.subject());
    assertEquals("Tue, 13 Feb 2024 21:21:26 +0000", snapshot.date());
    assertEquals("<abc@example.com>", snapshot.messageId());
  }

  @Test
  void firstOccurrenceWinsAndBlankInputIsEmpty() {
    HeaderSnapshot snapshot = HeaderSnapshot.parse("To: a@x\nTo: b@x\n");

    assertEquals("a@x", snapshot.to());
    assertEquals(HeaderSnapshot.empty(), HeaderSnapshot.parse(null));
    assertEquals(HeaderSnapshot.empty(), HeaderSnapshot.parse(" "));
  }

  @Test
  void decodeAppliesToHumanReadableFieldsOnly() {
    HeaderSnapshot snapshot = new HeaderSnapshot("f", "t", "s", "d", "m");

    HeaderSnapshot decoded = snapshot.decode(String::toUpperCase);

    assertEquals(new HeaderSnapshot("F", "T", "S", "d", "m"), decoded);
  }
}
