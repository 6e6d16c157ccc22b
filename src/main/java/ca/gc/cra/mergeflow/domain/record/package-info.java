/**
 * Decoded record values: the canonical {@link ca.gc.cra.mergeflow.domain.record.Header}, the
 * {@link ca.gc.cra.mergeflow.domain.record.RecordView} accessor, and the decoding failure hierarchy.
 * <p>Decoding failures are checked exceptions rooted at
 * {@link ca.gc.cra.mergeflow.domain.record.RecordDecodingException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.domain.record;
