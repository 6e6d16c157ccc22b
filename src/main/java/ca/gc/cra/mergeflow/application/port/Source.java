package ca.gc.cra.mergeflow.application.port;

import java.io.IOException;
import java.io.InputStream;

/**
 * <strong>What:</strong> Named, independently openable byte source.
 * <p><strong>Why:</strong> Decouples the multiplexer from files, object stores, or in-memory payloads.</p>
 * <p><strong>Role:</strong> Port supplied by callers or by a {@link SourceResolver}; borrowed by the
 * multiplexer one at a time.</p>
 * <p><strong>Thread-safety:</strong> {@link #open()} is invoked at most once per multiplex session, from the
 * multiplexer's producer thread.</p>
 *
 * @since 0.1.0
 */
public interface Source {
  /**
   * Returns the stable display name used in provenance snapshots and error messages.
   *
   * @return non-null display name
   */
  String name();

  /**
   * Opens a fresh byte stream over the source content. The caller owns and closes the stream.
   *
   * @return new input stream positioned at the first byte
   * @throws IOException if the source cannot be opened
   */
  InputStream open() throws IOException;
}
