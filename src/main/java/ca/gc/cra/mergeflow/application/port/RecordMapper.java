package ca.gc.cra.mergeflow.application.port;

import ca.gc.cra.mergeflow.domain.record.RecordView;

/**
 * Maps a decoded record to a typed value.
 *
 * @param <T> mapped type
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordMapper<T> {
  /**
   * Maps one record.
   *
   * @param record decoded record
   * @return mapped value
   * @throws Exception if the record cannot be mapped; stops iteration
   */
  T map(RecordView record) throws Exception;
}
