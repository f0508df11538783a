package ca.gc.cra.midscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingOrUnknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: midscan <resolve|mailboxes|search|providers>"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("mailboxes"));
  }

  @Test
  void subcommandHelpIsDispatched() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"resolve", "--help"}));
    assertTrue(buffer.toString().contains("MIDSCAN resolve"));
  }

  @Test
  void providersListsBuiltInsAndOverrides() throws Exception {
    Path file = tempDir.resolve("providers.json");
    Files.writeString(file, "{\"mycorp\": {\"server\": \"mail.mycorp.example.com\", \"port\": 143, \"ssl\": false}}");

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"providers", "providersFile=" + file}));

    String output = buffer.toString();
    assertTrue(output.contains("gmail        imap.gmail.com:993 (ssl)"));
    assertTrue(output.contains("mycorp       mail.mycorp.example.com:143" + System.lineSeparator()));
    assertTrue(output.indexOf("gmail") < output.indexOf("mycorp"));
  }
}
