package ca.gc.cra.midscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.midscan.application.pipeline.ResolutionListener;
import ca.gc.cra.midscan.application.pipeline.ResolveSummary;
import ca.gc.cra.midscan.application.port.ClockPort;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import ca.gc.cra.midscan.infrastructure.export.CsvResultExportAdapter;
import ca.gc.cra.midscan.infrastructure.export.NdjsonResultExportAdapter;
import ca.gc.cra.midscan.testutil.RecordingExport;
import ca.gc.cra.midscan.testutil.RecordingMetricsPort;
import ca.gc.cra.midscan.testutil.ScriptedMailSession;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void resultExportFollowsFormat() throws Exception {
    CompositionRoot root = new CompositionRoot(new RecordingMetricsPort());

    try (ResultExportPort csv = root.resultExport(tempDir.resolve("out.csv"), ExportFormat.CSV);
        ResultExportPort ndjson = root.resultExport(tempDir.resolve("out.ndjson"), ExportFormat.NDJSON)) {
      assertInstanceOf(CsvResultExportAdapter.class, csv);
      assertInstanceOf(NdjsonResultExportAdapter.class, ndjson);
    }
    assertTrue(Files.readString(tempDir.resolve("out.csv")).startsWith("message_id,matched,"));
  }

  @Test
  void sessionFactoryIsUsedForAccounts() {
    ScriptedMailSession session = new ScriptedMailSession();
    CompositionRoot root = new CompositionRoot(new RecordingMetricsPort(), ClockPort.SYSTEM, account -> session);

    ImapAccountConfig account =
        ImapAccountConfig.fromMap(Map.of("provider", "gmail", "user", "u"), ProviderDirectory.builtIn());
    assertSame(session, root.mailSession(account));
  }

  @Test
  void resolvePipelineWiresPreviewAndAggregation() throws Exception {
    ScriptedMailSession session = new ScriptedMailSession();
    session.mailbox("INBOX")
        .message(LocalDate.of(2024, 2, 13),
            "Message-ID", "<a@example.com>",
            "From", "ops@example.org",
            "Subject", "=?UTF-8?Q?Caf=C3=A9?=")
        .body("Quarterly numbers attached.");
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RecordingExport export = new RecordingExport();
    List<Optional<String>> previews = new ArrayList<>();
    ResolutionListener listener = new ResolutionListener() {
      @Override
      public void onResolved(ResolutionResult result, Optional<String> preview) {
        previews.add(preview);
      }
    };
    ResolveConfig config = ResolveConfig.fromMap(Map.of(
        "host", "imap.example.org",
        "user", "u",
        "ids", "<a@example.com>",
        "preview", "true",
        "hintDomains", "example.org"), ProviderDirectory.builtIn());

    CompositionRoot root = new CompositionRoot(metrics, ClockPort.SYSTEM, account -> session);
    ResolveSummary summary = root.resolveUseCase(config, session, export, listener)
        .run(List.of(MessageIdentifier.parse("<a@example.com>")));

    assertEquals(1, summary.matched());
    ResolutionResult.Matched match = (ResolutionResult.Matched) export.rows().get(0);
    assertEquals("INBOX", match.mailbox());
    assertEquals("Café", match.headers().subject());
    assertEquals(List.of(Optional.of("Quarterly numbers attached.")), previews);
    assertEquals(1, metrics.count("resolve.identifier.matched"));
  }
}
