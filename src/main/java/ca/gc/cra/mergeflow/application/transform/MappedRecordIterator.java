package ca.gc.cra.mergeflow.application.transform;

import ca.gc.cra.mergeflow.application.port.MappedIterator;
import ca.gc.cra.mergeflow.application.port.RecordIterator;
import ca.gc.cra.mergeflow.application.port.RecordMapper;
import ca.gc.cra.mergeflow.domain.record.RecordView;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MappedIterator} that applies a mapper to each record of an inner {@link RecordIterator}.
 */
final class MappedRecordIterator<T> implements MappedIterator<T> {
  private static final Logger log = LoggerFactory.getLogger(MappedRecordIterator.class);

  private final RecordIterator records;
  private final RecordMapper<T> mapper;
  private T value;
  private boolean hasValue;
  private Exception mapperError;

  MappedRecordIterator(RecordIterator records, RecordMapper<T> mapper) {
    this.records = Objects.requireNonNull(records, "records");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public boolean next() {
    hasValue = false;
    value = null;
    if (mapperError != null || !records.next()) {
      return false;
    }
    RecordView record = records.record();
    try {
      value = mapper.map(record);
      hasValue = true;
      return true;
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      mapperError = ex;
      log.warn("Mapping failed for record at {} line {}", record.meta(), record.lineNumber(), ex);
      return false;
    }
  }

  @Override
  public T value() {
    if (!hasValue) {
      throw new IllegalStateException("no current value; next() has not returned true");
    }
    return value;
  }

  /**
   * Returns the mapper failure if one occurred, otherwise the inner iterator's failure.
   */
  @Override
  public Optional<Exception> error() {
    return mapperError != null ? Optional.of(mapperError) : records.error();
  }

  @Override
  public void close() {
    records.close();
  }
}
