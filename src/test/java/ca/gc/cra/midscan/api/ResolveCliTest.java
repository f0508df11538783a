package ca.gc.cra.midscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.testutil.ScriptedMailSession;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ResolveCliTest {
  private static final LocalDate DAY = LocalDate.of(2024, 2, 13);

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;
  private ScriptedMailSession session;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ResolveCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    session = new ScriptedMailSession();
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingHostReturnsUsageAndInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {"user=u", "ids=a@example.com"}, environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: resolve"));
    assertTrue(loggedError("host is required for resolve"));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutput() {
    Path out = tempDir.resolve("matches.csv");

    ExitCode code = ResolveCli.run(new String[] {
        "provider=gmail", "user=u", "ids=<a@example.com>", "ids=b@example.com", "out=" + out, "--dry-run"},
        environment(Map.of()));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Resolve dry-run"));
    assertTrue(output.contains("imap.gmail.com:993 (ssl)"));
    assertTrue(output.contains("Identifiers       : 2"));
    assertFalse(Files.exists(out));
    assertTrue(session.calls().isEmpty());
  }

  @Test
  void resolvesAndWritesCsv() throws IOException {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<a@example.com>", "Subject", "Invoice", "Date", "Tue");
    Path out = tempDir.resolve("matches.csv");

    ExitCode code = ResolveCli.run(new String[] {
        "host=imap.example.org", "user=ops", "ids=<a@example.com>,<missing@example.com>", "out=" + out},
        environment(Map.of(SecretResolver.ENV_PASS, "s3cret")));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("== Searching Message-ID: <a@example.com> =="));
    assertTrue(output.contains("  - INBOX: seq 1 | Tue | Invoice"));
    assertTrue(output.contains("  (not found)"));
    assertTrue(output.contains("Done. Found 1 matches"));
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(1).startsWith("a@example.com,true,INBOX,exact_header_match,1,"));
    assertEquals("missing@example.com,,,,,,,,", lines.get(2));
    assertEquals("ops", session.loggedInUser());
    assertTrue(session.closed());
  }

  @Test
  void identifiersFileIsRead() throws IOException {
    session.mailbox("INBOX").message(DAY, "Message-ID", "<a@example.com>");
    Path ids = tempDir.resolve("ids.txt");
    Files.writeString(ids, "# batch\n<a@example.com>\n");
    Path out = tempDir.resolve("matches.ndjson");

    ExitCode code = ResolveCli.run(new String[] {
        "host=imap.example.org", "user=ops", "idsFile=" + ids, "out=" + out, "format=ndjson"},
        environment(Map.of(SecretResolver.ENV_PASS, "s3cret")));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.readString(out).contains("\"matched\":true"));
  }

  @Test
  void connectionLossReturnsTransportFailureAndKeepsHeader() throws IOException {
    session.mailbox("INBOX");
    session.dropConnectionOnSelect("INBOX");
    Path out = tempDir.resolve("matches.csv");

    ExitCode code = ResolveCli.run(new String[] {
        "host=imap.example.org", "user=ops", "ids=a@example.com", "out=" + out},
        environment(Map.of(SecretResolver.ENV_PASS, "s3cret")));

    assertEquals(ExitCode.TRANSPORT_FAILURE, code);
    assertEquals(1, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    assertTrue(session.closed());
  }

  @Test
  void missingPasswordReturnsInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {
        "host=imap.example.org", "user=ops", "ids=a@example.com", "out=" + tempDir.resolve("m.csv")},
        environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(session.calls().isEmpty());
  }

  @Test
  void existingOutputRequiresOverwritePermission() throws IOException {
    Path out = Files.writeString(tempDir.resolve("matches.csv"), "previous run\n");

    ExitCode code = ResolveCli.run(new String[] {
        "host=imap.example.org", "user=ops", "ids=a@example.com", "out=" + out, "allowOverwrite=false"},
        environment(Map.of(SecretResolver.ENV_PASS, "s3cret")));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("--allow-overwrite"));
    assertEquals("previous run\n", Files.readString(out));
  }

  @Test
  void yamlConfigSuppliesSettingsAndCliOverrides() throws IOException {
    Path yaml = tempDir.resolve("midscan.yaml");
    Files.writeString(yaml, """
        common:
          provider: outlook
          user: ops@example.com
        resolve:
          ids: [a@example.com]
          mailboxes: INBOX
        """);

    ExitCode code = ResolveCli.run(new String[] {
        "config=" + yaml, "user=auditor@example.com", "out=" + tempDir.resolve("m.csv"), "--dry-run"},
        environment(Map.of()));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("outlook.office365.com:993"));
    assertTrue(output.contains("User              : auditor@example.com"));
    assertTrue(output.contains("Mailbox source    : EXPLICIT [INBOX]"));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, environment(Map.of()));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  private CliEnvironment environment(Map<String, String> variables) {
    return new CliEnvironment(variables, account -> session, () -> null);
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }
}
