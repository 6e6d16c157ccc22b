/**
 * Source provenance values and the failures a merged stream can report about its sources.
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.domain.source;
