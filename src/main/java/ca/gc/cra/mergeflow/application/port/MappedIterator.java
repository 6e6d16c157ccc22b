package ca.gc.cra.mergeflow.application.port;

import java.util.Optional;

/**
 * Pull-style cursor over mapped values. Same contract as {@link RecordIterator}.
 *
 * @param <T> mapped type
 * @since 0.1.0
 */
public interface MappedIterator<T> extends AutoCloseable {
  boolean next();

  /**
   * Returns the value produced for the current record.
   *
   * @return mapped value
   * @throws IllegalStateException if no value has been reached
   */
  T value();

  Optional<Exception> error();

  @Override
  void close();
}
