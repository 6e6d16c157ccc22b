/**
 * Metrics adapters implementing {@link ca.gc.cra.mergeflow.application.port.MetricsPort}.
 * <p>{@code OpenTelemetryMetricsAdapter} exports through the OpenTelemetry SDK; {@code NoOpMetricsAdapter}
 * drops everything.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.infrastructure.metrics;
