/**
 * Stream multiplexer merging ordered sources into one provenance-aware byte stream.
 * <p><strong>Concurrency:</strong> One daemon producer per multiplexer, named {@code mergeflow-mux-*}; byte
 * handoff is bounded, boundary publication never blocks the producer.</p>
 * <p><strong>Resources:</strong> At most one source handle is open at a time; {@code close()} releases it
 * without waiting for the producer.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.infrastructure.mux;
