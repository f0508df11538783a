package ca.gc.cra.midscan.config;

import java.util.Locale;

/**
 * Output file formats for resolution results.
 *
 * @since 0.1.0
 */
public enum ExportFormat {
  CSV,
  NDJSON;

  /**
   * Parses a {@code format=} option.
   *
   * @param raw option value; blank means {@link #CSV}
   * @return format
   * @throws IllegalArgumentException for unknown formats
   */
  public static ExportFormat fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return CSV;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "csv" -> CSV;
      case "ndjson", "jsonl" -> NDJSON;
      default -> throw new IllegalArgumentException("format must be csv or ndjson (was " + raw + ")");
    };
  }
}
