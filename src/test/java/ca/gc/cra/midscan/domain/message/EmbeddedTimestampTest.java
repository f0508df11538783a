package ca.gc.cra.midscan.domain.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EmbeddedTimestampTest {

  @Test
  void extractsLeadingTimestampFollowedBySeparator() {
    assertEquals(
        Optional.of(LocalDateTime.of(2024, 2, 13, 21, 21, 26)),
        EmbeddedTimestamp.extract("<20240213212126.4429A161827048B0@gmail.com>"));
    assertEquals(
        Optional.of(LocalDateTime.of(2023, 12, 31, 23, 59, 59)),
        EmbeddedTimestamp.extract("20231231235959-xyz@example.com"));
    assertEquals(
        Optional.of(LocalDateTime.of(2020, 1, 1, 0, 0, 0)),
        EmbeddedTimestamp.extract(MessageIdentifier.parse("20200101000000@host")));
  }

  @Test
  void ignoresIdentifiersWithoutValidTimestamp() {
    assertTrue(EmbeddedTimestamp.extract("CAB1234@mail.gmail.com").isEmpty());
    assertTrue(EmbeddedTimestamp.extract("2024021321212.short@example.com").isEmpty());
    assertTrue(EmbeddedTimestamp.extract("20240213212126abc@example.com").isEmpty());
    assertTrue(EmbeddedTimestamp.extract("20241301000000.x@example.com").isEmpty(), "month 13");
    assertTrue(EmbeddedTimestamp.extract("20230229120000.x@example.com").isEmpty(), "not a leap year");
    assertTrue(EmbeddedTimestamp.extract((String) null).isEmpty());
  }
}
