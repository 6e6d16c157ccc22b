/**
 * <strong>Purpose:</strong> Ports defining the source -> multiplexer -> decoder -> mapper contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Streams and iterators are single-consumer; metrics ports must be
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe
 * implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.application.port;
