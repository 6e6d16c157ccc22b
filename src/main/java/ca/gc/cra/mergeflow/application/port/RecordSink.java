package ca.gc.cra.mergeflow.application.port;

import ca.gc.cra.mergeflow.domain.record.RecordView;

/**
 * Consumes records produced by a merge run.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordSink {
  /**
   * Accepts one record.
   *
   * @param record decoded record; only valid for the duration of the call
   * @throws Exception if the record cannot be consumed; stops the run
   */
  void accept(RecordView record) throws Exception;
}
