package ca.gc.cra.midscan.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Metrics export settings resolved from CLI, YAML and environment.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint; ignored when the exporter is {@code none}
 * @param resourceAttributes extra {@code key=value,...} resource attributes; may be empty
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    if (exporter.equals("otlp")) {
      validateEndpoint(endpoint);
    }
  }

  /**
   * Returns settings with export disabled.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  /**
   * Indicates whether metrics are exported.
   *
   * @return {@code true} for the OTLP exporter
   */
  public boolean enabled() {
    return exporter.equals("otlp");
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
