package ca.gc.cra.mergeflow.domain.record;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable row decoded from delimited text, validated against the canonical header.
 *
 * @since 0.1.0
 */
public final class DelimitedRecord implements RecordView {
  private final Header header;
  private final List<String> fields;
  private final SourceMeta meta;
  private final long lineNumber;

  /**
   * Creates a record.
   *
   * @param header canonical header
   * @param fields field values; must have the header's length
   * @param meta provenance captured at classification time
   * @param lineNumber 1-based line within the source, or {@code 0} when unknown
   * @throws IllegalArgumentException if the field count differs from the header length
   */
  public DelimitedRecord(Header header, List<String> fields, SourceMeta meta, long lineNumber) {
    this.header = Objects.requireNonNull(header, "header");
    this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    this.meta = Objects.requireNonNull(meta, "meta");
    this.lineNumber = lineNumber;
    if (this.fields.size() != header.size()) {
      throw new IllegalArgumentException(
          "record has " + this.fields.size() + " fields, header has " + header.size());
    }
  }

  @Override
  public Optional<String> byIndex(int index) {
    if (index < 0 || index >= fields.size()) {
      return Optional.empty();
    }
    return Optional.of(fields.get(index));
  }

  @Override
  public Optional<String> byName(String name) {
    OptionalInt position = header.indexOf(name);
    return position.isPresent() ? byIndex(position.getAsInt()) : Optional.empty();
  }

  @Override
  public int size() {
    return fields.size();
  }

  @Override
  public List<String> names() {
    return header.names();
  }

  @Override
  public SourceMeta meta() {
    return meta;
  }

  @Override
  public long lineNumber() {
    return lineNumber;
  }

  /**
   * Returns the field values in header order.
   *
   * @return immutable value list
   */
  public List<String> fields() {
    return fields;
  }

  public Header header() {
    return header;
  }

  @Override
  public String toString() {
    return "DelimitedRecord{" + meta + ", line=" + lineNumber + ", fields=" + fields + '}';
  }
}
