package ca.gc.cra.midscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntChecksRange() {
    assertEquals(993, Numbers.parseInt("port", " 993 ", 1, 65_535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("port", "0", 1, 65_535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("port", "imaps", 1, 65_535));
  }

  @Test
  void requireRangeIsInclusive() {
    assertEquals(3_600L, Numbers.requireRange("timeoutSeconds", 3_600, 1, 3_600));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("timeoutSeconds", 3_601, 1, 3_600));
  }
}
