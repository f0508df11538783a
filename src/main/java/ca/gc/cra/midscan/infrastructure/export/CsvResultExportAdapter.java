package ca.gc.cra.midscan.infrastructure.export;

import ca.gc.cra.midscan.application.port.ExportRow;
import ca.gc.cra.midscan.application.port.ResultExportPort;
import ca.gc.cra.midscan.domain.resolve.ResolutionResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes one RFC 4180 CSV row per result, header first. Rows are flushed as they arrive so a run aborted by a
 * connection loss still leaves the completed rows on disk.
 *
 * @since 0.1.0
 */
public final class CsvResultExportAdapter implements ResultExportPort {
  private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
      .setHeader(ExportRow.COLUMNS.toArray(new String[0]))
      .build();

  private final CSVPrinter printer;
  private int rows;

  /**
   * Opens (truncating) the target file and writes the header row.
   *
   * @param target output file
   * @throws IOException if the file cannot be opened
   */
  public CsvResultExportAdapter(Path target) throws IOException {
    this(Files.newBufferedWriter(Objects.requireNonNull(target, "target"), StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
  }

  CsvResultExportAdapter(Writer writer) throws IOException {
    this.printer = new CSVPrinter(Objects.requireNonNull(writer, "writer"), FORMAT);
    printer.flush();
  }

  @Override
  public synchronized void write(ResolutionResult result) throws IOException {
    printer.printRecord(ExportRow.from(Objects.requireNonNull(result, "result")).values());
    printer.flush();
    rows++;
  }

  /**
   * Returns the number of data rows written.
   *
   * @return row count excluding the header
   */
  public synchronized int rowsWritten() {
    return rows;
  }

  @Override
  public synchronized void close() throws IOException {
    printer.close();
  }
}
