package ca.gc.cra.midscan.infrastructure.export;

import ca.gc.cra.midscan.application.port.ExportRow;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes one JSON object per line using Jackson's streaming generator. Field names follow the CSV columns;
 * {@code matched} is a boolean and {@code seqnum} a number ({@code null} when not found).
 *
 * @since 0.1.0
 */
public final class NdjsonResultExportAdapter implements ResultExportPort {
  private final JsonGenerator generator;

  /**
   * Opens (truncating) the target file.
   *
   * @param target output file
   * @throws IOException if the file cannot be opened
   */
  public NdjsonResultExportAdapter(Path target) throws IOException {
    this(Files.newBufferedWriter(Objects.requireNonNull(target, "target"), StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
  }

  NdjsonResultExportAdapter(Writer writer) throws IOException {
    this.generator = new JsonFactory().createGenerator(Objects.requireNonNull(writer, "writer"));
    this.generator.setRootValueSeparator(null);
  }

  @Override
  public synchronized void write(ResolutionResult result) throws IOException {
    ExportRow row = ExportRow.from(Objects.requireNonNull(result, "result"));
    generator.writeStartObject();
    generator.writeStringField("message_id", row.messageId());
    generator.writeBooleanField("matched", result.matched());
    if (result instanceof ResolutionResult.Matched match) {
      generator.writeStringField("mailbox", match.mailbox());
      generator.writeStringField("tier", match.tier().label());
      generator.writeNumberField("seqnum", match.sequenceRef());
    } else {
      generator.writeNullField("mailbox");
      generator.writeNullField("tier");
      generator.writeNullField("seqnum");
    }
    generator.writeStringField("from", row.from());
    generator.writeStringField("to", row.to());
    generator.writeStringField("subject", row.subject());
    generator.writeStringField("date", row.date());
    generator.writeEndObject();
    generator.writeRaw('\n');
    generator.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    generator.close();
  }
}
