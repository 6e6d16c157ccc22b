package ca.gc.cra.mergeflow.application.port;

import ca.gc.cra.mergeflow.domain.record.RecordView;
import java.util.Optional;

/**
 * <strong>What:</strong> Pull-style cursor over decoded records.
 * <p><strong>Contract:</strong> {@link #next()} returns {@code false} both on clean exhaustion and on failure;
 * {@link #error()} tells them apart. Failures are sticky.</p>
 * <p><strong>Thread-safety:</strong> Single consumer; {@link #close()} may be called from another thread to
 * cancel a blocked {@code next()}.</p>
 *
 * @since 0.1.0
 */
public interface RecordIterator extends AutoCloseable {
  /**
   * Advances to the next record.
   *
   * @return {@code true} when a record is available through {@link #record()}
   */
  boolean next();

  /**
   * Returns the record reached by the last successful {@link #next()}.
   *
   * @return current record
   * @throws IllegalStateException if no record has been reached
   */
  RecordView record();

  /**
   * Returns the terminal failure, if any.
   *
   * @return failure, or empty after clean exhaustion or while iteration is still in progress
   */
  Optional<Exception> error();

  /** Closes the underlying stream. Idempotent. */
  @Override
  void close();
}
