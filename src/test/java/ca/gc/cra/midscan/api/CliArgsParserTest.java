package ca.gc.cra.midscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void repeatedIdsAccumulate() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "ids=<a@example.com>", "user=first", "ids=b@example.com", "user=second"});

    assertEquals("<a@example.com>,b@example.com", map.get("ids"));
    assertEquals("second", map.get("user"));
  }

  @Test
  void valuesMayContainEqualsSigns() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod,team=ops"});

    assertEquals("env=prod,team=ops", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"host"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"host="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"user=a\u0007b"}));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "host=h", "--VERBOSE", " ", "--allow-overwrite"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--allow-overwrite"));
    assertTrue(input.verbose());
    assertEquals(1, input.keyValueArgs().length);
  }
}
