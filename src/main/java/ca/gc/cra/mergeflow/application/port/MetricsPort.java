package ca.gc.cra.mergeflow.application.port;

/**
 * <strong>What:</strong> Port abstracting MERGEFLOW metrics emission.
 * <p><strong>Why:</strong> Lets the multiplexer and decoder record counters and observations without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from producer and consumer
 * threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code mux.source.opened},
 * {@code decode.headers.skipped}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (bytes, nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
