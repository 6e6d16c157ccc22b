package ca.gc.cra.mergeflow.application.port;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * <strong>What:</strong> Merged byte stream that reports which source produced the bytes it delivers.
 * <p><strong>Why:</strong> Record decoders need source boundaries to recognise per-source header rows.</p>
 * <p><strong>Role:</strong> Port implemented by the stream multiplexer and consumed by record decoders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver the bytes of every source in list order, then report end-of-stream.</li>
 *   <li>Never return bytes of two sources from a single {@link #read(byte[], int, int)} call.</li>
 *   <li>Publish a non-blocking {@link #current()} snapshot and a coalescing boundary signal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single consumer. {@link #current()} may be read concurrently with
 * {@code read} and {@code awaitBoundary}; {@link #close()} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public interface SourceAwareStream extends Closeable {
  /**
   * Reads merged bytes.
   *
   * @param buffer destination
   * @param offset first index to write
   * @param length maximum number of bytes to read
   * @return bytes read, or {@code -1} once every source is exhausted
   * @throws IOException on source open/read failure (sticky), after close, or when interrupted
   */
  int read(byte[] buffer, int offset, int length) throws IOException;

  /**
   * Returns a snapshot of the source and offset of the bytes most recently delivered. Observed by the reading
   * thread right after a read, the snapshot names the source of the returned bytes with the offset just past
   * them.
   *
   * @return provenance snapshot; {@link SourceMeta#NONE} before any source begins
   */
  SourceMeta current();

  /**
   * Blocks until the next source boundary is published.
   *
   * @return the boundary snapshot, or empty once the stream has finished and no boundary is pending
   * @throws InterruptedException if the waiting thread is interrupted
   */
  Optional<SourceMeta> awaitBoundary() throws InterruptedException;

  /**
   * Blocks until the next source boundary is published or the timeout elapses.
   *
   * @param timeout maximum wait
   * @return the boundary snapshot, or empty once the stream has finished and no boundary is pending
   * @throws InterruptedException if the waiting thread is interrupted
   * @throws TimeoutException if no boundary arrived within {@code timeout}
   */
  Optional<SourceMeta> awaitBoundary(Duration timeout) throws InterruptedException, TimeoutException;

  /**
   * Stops the producer and releases the open source handle. Idempotent and never waits for the producer.
   *
   * @throws IOException never thrown by the multiplexer; declared by {@link Closeable}
   */
  @Override
  void close() throws IOException;
}
