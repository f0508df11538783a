package ca.gc.cra.midscan.api;

import ca.gc.cra.midscan.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.midscan.validation.Strings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds OpenTelemetry export settings from merged CLI configuration.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings settings(Map<String, String> effective) {
    if (effective == null || effective.isEmpty()) {
      return TelemetrySettings.disabled();
    }
    String attributes = effective.getOrDefault("otelResourceAttributes", "").trim();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings settings = new TelemetrySettings(
        effective.get("metricsExporter"), effective.get("otelEndpoint"), attributes);
    if (settings.enabled()) {
      log.debug("Configuring OTLP metrics export to {}", settings.endpoint());
    }
    return settings;
  }
}
