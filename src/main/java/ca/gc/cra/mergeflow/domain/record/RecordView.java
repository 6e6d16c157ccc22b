package ca.gc.cra.mergeflow.domain.record;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only accessor over one decoded row.
 * <p><strong>Role:</strong> Value handed from record iterators to callers and mappers.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable.</p>
 * <p>Lookups that miss report "not found" through an empty {@link Optional} rather than failing.</p>
 *
 * @since 0.1.0
 */
public interface RecordView {
  /**
   * Returns the field at a position.
   *
   * @param index zero-based position
   * @return field value, or empty when {@code index} is out of range
   */
  Optional<String> byIndex(int index);

  /**
   * Returns the field with a header name.
   *
   * @param name case-sensitive header name
   * @return field value, or empty when the name is not part of the header
   */
  Optional<String> byName(String name);

  /**
   * Returns the number of fields in the record.
   *
   * @return field count
   */
  int size();

  /**
   * Returns the canonical header names.
   *
   * @return immutable name list
   */
  List<String> names();

  /**
   * Returns the provenance captured when the row was classified.
   *
   * @return source snapshot
   */
  SourceMeta meta();

  /**
   * Returns the 1-based line within its source at which the row started.
   *
   * @return line number, or {@code 0} when unknown
   */
  long lineNumber();
}
