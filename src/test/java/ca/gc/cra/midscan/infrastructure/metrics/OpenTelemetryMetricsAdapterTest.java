package ca.gc.cra.midscan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void countersKeepOriginalKeyAsAttribute() {
    adapter.increment("resolve.mailbox.selectFailed");
    adapter.increment("resolve.mailbox.selectFailed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "resolve.mailbox.selectfailed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("resolve.mailbox.selectFailed",
        point.getAttributes().get(AttributeKey.stringKey("midscan.metric.key")));
    assertEquals("midscan", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("resolve.identifier.latencyMillis", 40);
    adapter.observe("resolve.identifier.latencyMillis", 60);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "resolve.identifier.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum(), 0.0001);
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("resolve.tier.exact_header_match.matched",
        OpenTelemetryMetricsAdapter.sanitizeName("resolve.tier.exact_header_match.matched"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
    assertEquals("midscan.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledSettingsYieldNoopAdapter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      assertTrue(noop.isNoop());
      noop.increment("resolve.search.attempts");
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
