package ca.gc.cra.mergeflow.application.port;

import ca.gc.cra.mergeflow.domain.record.RecordDecodingException;

/**
 * <strong>What:</strong> Turns a merged source-aware stream into records.
 * <p><strong>Role:</strong> Port implemented by the boundary-aware delimited record decoder.</p>
 * <p><strong>Thread-safety:</strong> Decoders are stateless factories; each call creates an independent
 * session.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordDecoder {
  /**
   * Starts a decode session. The returned iterator owns {@code stream} and closes it.
   *
   * @param stream merged stream; must not be {@code null}
   * @return record iterator
   * @throws RecordDecodingException if no canonical header can be established; the stream is closed
   */
  RecordIterator decode(SourceAwareStream stream) throws RecordDecodingException;
}
