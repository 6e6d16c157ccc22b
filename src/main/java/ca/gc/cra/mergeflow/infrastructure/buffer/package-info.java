/**
 * Buffer pooling backing the multiplexer's bounded chunk handoff.
 * <p><strong>Concurrency:</strong> Pools are thread-safe; a borrowed buffer has a single owner at a time.</p>
 * <p><strong>Performance:</strong> Keeps steady-state allocation independent of the merged stream's size.</p>
 */
package ca.gc.cra.mergeflow.infrastructure.buffer;
