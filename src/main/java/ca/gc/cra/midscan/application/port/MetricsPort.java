package ca.gc.cra.midscan.application.port;

/**
 * <strong>What:</strong> Port abstracting resolver metrics emission.
 * <p><strong>Why:</strong> Lets the orchestrator count selections, attempts and matches without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@link #NO_OP}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code resolve.mailbox.selectFailed}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name such as {@code resolve.search.attempts}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, in units defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
