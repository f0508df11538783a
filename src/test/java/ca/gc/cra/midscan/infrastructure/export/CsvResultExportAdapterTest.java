package ca.gc.cra.midscan.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultExportAdapterTest {
  @TempDir Path tempDir;

  @Test
  void writesHeaderAndOneRowPerResult() throws Exception {
    StringWriter buffer = new StringWriter();
    CsvResultExportAdapter adapter = new CsvResultExportAdapter(buffer);

    adapter.write(new ResolutionResult.Matched(
        MessageIdentifier.parse("<a@example.com>"),
        "[Gmail]/All Mail",
        SearchTier.EXACT_HEADER_MATCH,
        42,
        new HeaderSnapshot("Alice <a@example.com>", "b@example.com", "Hi, \"team\"", "Tue, 13 Feb 2024", "")));
    adapter.write(new ResolutionResult.NotFound(MessageIdentifier.parse("missing@example.com")));
    adapter.close();

    assertEquals(2, adapter.rowsWritten());
    assertEquals(
        "message_id,matched,mailbox,tier,seqnum,from,to,subject,date\r\n"
            + "a@example.com,true,[Gmail]/All Mail,exact_header_match,42,Alice <a@example.com>,b@example.com,"
            + "\"Hi, \"\"team\"\"\",\"Tue, 13 Feb 2024\"\r\n"
            + "missing@example.com,,,,,,,,\r\n",
        buffer.toString());
  }

  @Test
  void fileTargetIsTruncatedAndFlushedPerRow() throws Exception {
    Path out = tempDir.resolve("matches.csv");
    Files.writeString(out, "stale content that should disappear\n");

    CsvResultExportAdapter adapter = new CsvResultExportAdapter(out);
    adapter.write(new ResolutionResult.NotFound(MessageIdentifier.parse("x@y")));

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(2, lines.size(), "row is visible before close");
    adapter.close();
    assertEquals("x@y,,,,,,,,", Files.readAllLines(out, StandardCharsets.UTF_8).get(1));
  }

  @Test
  void foldedSubjectIsQuotedOnOneRecord() throws Exception {
    StringWriter buffer = new StringWriter();
    CsvResultExportAdapter adapter = new CsvResultExportAdapter(buffer);

    adapter.write(new ResolutionResult.Matched(
        MessageIdentifier.parse("a@b"), "INBOX", SearchTier.TIME_WINDOW_MATCH, 7,
        new HeaderSnapshot("plain", "", "line one\nline two", "", "")));
    adapter.close();

    assertEquals(
        "message_id,matched,mailbox,tier,seqnum,from,to,subject,date\r\n"
            + "a@b,true,INBOX,time_window_match,7,plain,,\"line one\nline two\",\r\n",
        buffer.toString());
  }
}
