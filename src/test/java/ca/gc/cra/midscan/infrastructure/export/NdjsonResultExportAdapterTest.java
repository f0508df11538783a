package ca.gc.cra.midscan.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.domain.message.HeaderSnapshot;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import ca.gc.cra.midscan.domain.resolve.SearchTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class NdjsonResultExportAdapterTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void writesOneJsonObjectPerLine() throws Exception {
    StringWriter buffer = new StringWriter();
    NdjsonResultExportAdapter adapter = new NdjsonResultExportAdapter(buffer);

    adapter.write(new ResolutionResult.Matched(
        MessageIdentifier.parse("<a@example.com>"),
        "Trash",
        SearchTier.TIME_WINDOW_MATCH,
        5,
        new HeaderSnapshot("a@example.com", "", "Subject\nwith newline", "", "")));
    adapter.write(new ResolutionResult.NotFound(MessageIdentifier.parse("b@example.com")));
    adapter.close();

    String[] lines = buffer.toString().split("\n");
    assertEquals(2, lines.length);

    JsonNode matched = MAPPER.readTree(lines[0]);
    assertEquals("a@example.com", matched.get("message_id").asText());
    assertTrue(matched.get("matched").asBoolean());
    assertEquals("Trash", matched.get("mailbox").asText());
    assertEquals("time_window_match", matched.get("tier").asText());
    assertEquals(5, matched.get("seqnum").asInt());
    assertEquals("Subject\nwith newline", matched.get("subject").asText());

    JsonNode missing = MAPPER.readTree(lines[1]);
    assertEquals("b@example.com", missing.get("message_id").asText());
    assertTrue(missing.get("mailbox").isNull());
    assertTrue(missing.get("seqnum").isNull());
  }
}
