package ca.gc.cra.mergeflow.infrastructure.metrics;

import ca.gc.cra.mergeflow.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; selected when metrics are disabled in configuration.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /**
   * Creates a no-op metrics adapter.
   */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
