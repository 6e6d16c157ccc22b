package ca.gc.cra.mergeflow.domain.record;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.util.Objects;

/**
 * Raised when a row is malformed or its field count disagrees with the canonical header.
 *
 * @since 0.1.0
 */
public final class RecordParseException extends RecordDecodingException {
  private static final long serialVersionUID = 1L;

  private final SourceMeta meta;
  private final long lineNumber;

  /**
   * Creates a parse failure located at a row of a source.
   *
   * @param message description of the failure
   * @param meta provenance of the offending row
   * @param lineNumber 1-based line within the source at which the row started; {@code 0} when unknown
   */
  public RecordParseException(String message, SourceMeta meta, long lineNumber) {
    this(message, meta, lineNumber, null);
  }

  /**
   * Creates a parse failure located at a row of a source, with an underlying cause.
   *
   * @param message description of the failure
   * @param meta provenance of the offending row
   * @param lineNumber 1-based line within the source at which the row started; {@code 0} when unknown
   * @param cause underlying parser failure; may be {@code null}
   */
  public RecordParseException(String message, SourceMeta meta, long lineNumber, Throwable cause) {
    super(format(message, meta, lineNumber), cause);
    this.meta = Objects.requireNonNull(meta, "meta");
    this.lineNumber = lineNumber;
  }

  public SourceMeta meta() {
    return meta;
  }

  public long lineNumber() {
    return lineNumber;
  }

  private static String format(String message, SourceMeta meta, long lineNumber) {
    String where = meta == null || meta.name().isEmpty() ? "<stream>" : meta.name();
    if (lineNumber > 0) {
      where = where + ":" + lineNumber;
    }
    return where + ": " + message;
  }
}
