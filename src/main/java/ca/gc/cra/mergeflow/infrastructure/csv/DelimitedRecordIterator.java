package ca.gc.cra.mergeflow.infrastructure.csv;

import ca.gc.cra.mergeflow.application.port.MetricsPort;
import ca.gc.cra.mergeflow.application.port.RecordIterator;
import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.domain.record.DelimitedRecord;
import ca.gc.cra.mergeflow.domain.record.Header;
import ca.gc.cra.mergeflow.domain.record.HeaderConfigurationException;
import ca.gc.cra.mergeflow.domain.record.RecordParseException;
import ca.gc.cra.mergeflow.domain.record.RecordView;
import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import ca.gc.cra.mergeflow.logging.Logs;
import de.siegmar.fastcsv.reader.CsvParseException;
import de.siegmar.fastcsv.reader.CsvReader;
import de.siegmar.fastcsv.reader.CsvRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decode session classifying the rows of a merged stream against one canonical header.
 * <p><strong>Why:</strong> Sources that each repeat the header must yield the header once, while a first row
 * that merely differs from the header is always kept as data.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link RecordIterator}.</p>
 * <p><strong>State machine:</strong>
 * <ul>
 *   <li>{@code AT_SOURCE_START}: a row equal to the header is dropped; any other row is held in the pushback
 *   slot and the session moves to {@code PENDING_SERVE}; an empty source moves on to the next one.</li>
 *   <li>{@code PENDING_SERVE}: serves the held row with the provenance captured when it was classified.</li>
 *   <li>{@code NORMAL}: serves rows directly until the source ends.</li>
 *   <li>{@code EXHAUSTED} and {@code FAILED} are terminal; a failure stays retrievable through
 *   {@link #error()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single consumer; {@link #close()} may be called from another thread.</p>
 * <p><strong>Observability:</strong> Emits {@code decode.records.served}, {@code decode.headers.skipped} and
 * {@code decode.rows.rejected}.</p>
 *
 * @since 0.1.0
 */
final class DelimitedRecordIterator implements RecordIterator {
  private static final Logger log = LoggerFactory.getLogger(DelimitedRecordIterator.class);

  enum State {
    AT_SOURCE_START,
    NORMAL,
    PENDING_SERVE,
    EXHAUSTED,
    FAILED
  }

  private final SourceAwareStream stream;
  private final SourceSegments segments;
  private final DecoderOptions options;
  private final MetricsPort metrics;
  private final AtomicBoolean closed = new AtomicBoolean();

  private Header header;
  private State state;
  private CsvReader<CsvRecord> reader;
  private QuoteTrackingReader text;
  private Iterator<CsvRecord> rows;
  private DelimitedRecord pending;
  private DelimitedRecord current;
  private Exception error;
  private long served;

  private DelimitedRecordIterator(SourceAwareStream stream, DecoderOptions options, MetricsPort metrics) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.segments = new SourceSegments(stream);
  }

  /**
   * Opens a decode session and establishes the canonical header.
   *
   * @throws HeaderConfigurationException if the header has duplicate names or cannot be inferred; the stream
   *     is closed before the exception propagates
   */
  static DelimitedRecordIterator start(SourceAwareStream stream, DecoderOptions options, MetricsPort metrics)
      throws HeaderConfigurationException {
    DelimitedRecordIterator iterator = new DelimitedRecordIterator(stream, options, metrics);
    try {
      iterator.establishHeader();
    } catch (HeaderConfigurationException ex) {
      iterator.close();
      throw ex;
    }
    return iterator;
  }

  @Override
  public boolean next() {
    if (closed.get() || state == State.EXHAUSTED || state == State.FAILED) {
      current = null;
      return false;
    }
    try {
      return advance();
    } catch (RecordParseException ex) {
      metrics.increment("decode.rows.rejected");
      return fail(ex);
    } catch (IOException | RuntimeException ex) {
      return fail(ex);
    }
  }

  @Override
  public RecordView record() {
    if (current == null) {
      throw new IllegalStateException("no current record; next() has not returned true");
    }
    return current;
  }

  @Override
  public Optional<Exception> error() {
    return Optional.ofNullable(error);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      stream.close();
    } catch (IOException ex) {
      log.warn("Failed to close merged stream", ex);
    }
    log.debug("Decode session closed after {} records", served);
  }

  Header header() {
    return header;
  }

  State state() {
    return state;
  }

  private void establishHeader() throws HeaderConfigurationException {
    Optional<List<String>> explicit = options.explicitHeader();
    if (explicit.isPresent()) {
      header = Header.of(explicit.get());
      state = State.AT_SOURCE_START;
      log.debug("Using configured header {}", header.names());
      return;
    }
    try {
      while (openNextSegment()) {
        RawRow row = nextRow();
        if (row != null) {
          header = Header.of(row.fields());
          state = State.NORMAL;
          log.debug("Inferred header {} from {}", header.names(), row.meta().name());
          return;
        }
      }
    } catch (IOException | RecordParseException | RuntimeException ex) {
      throw new HeaderConfigurationException(
          "unable to infer header from first record: " + ex.getMessage(), ex);
    }
    throw new HeaderConfigurationException(
        "unable to infer header from first record: stream produced no rows");
  }

  private boolean advance() throws IOException, RecordParseException {
    while (true) {
      switch (state) {
        case PENDING_SERVE -> {
          current = pending;
          pending = null;
          state = State.NORMAL;
          return serve();
        }
        case NORMAL -> {
          RawRow row = nextRow();
          if (row != null) {
            current = toRecord(row);
            return serve();
          }
          if (!openNextSegment()) {
            return exhausted();
          }
          state = State.AT_SOURCE_START;
        }
        case AT_SOURCE_START -> {
          RawRow row = nextRow();
          if (row == null) {
            if (!openNextSegment()) {
              return exhausted();
            }
          } else if (header.matches(row.fields())) {
            metrics.increment("decode.headers.skipped");
            log.debug("Skipped repeated header at {} line {}", row.meta().name(), row.line());
          } else {
            pending = toRecord(row);
            state = State.PENDING_SERVE;
          }
        }
        default -> {
          return false;
        }
      }
    }
  }

  private boolean serve() {
    served++;
    metrics.increment("decode.records.served");
    return true;
  }

  private boolean exhausted() {
    closeReader();
    state = State.EXHAUSTED;
    current = null;
    log.debug("Decode session exhausted after {} records", served);
    return false;
  }

  private boolean fail(Exception ex) {
    closeReader();
    error = ex;
    state = State.FAILED;
    pending = null;
    current = null;
    log.warn("Decode session failed after {} records: {}", served, ex.getMessage());
    return false;
  }

  private DelimitedRecord toRecord(RawRow row) throws RecordParseException {
    if (row.fields().size() != header.size()) {
      throw new RecordParseException(
          "record has " + row.fields().size() + " fields, header has " + header.size()
              + ": " + Logs.row(row.fields()),
          row.meta(),
          row.line());
    }
    return new DelimitedRecord(header, row.fields(), row.meta(), row.line());
  }

  private boolean openNextSegment() throws IOException {
    closeReader();
    InputStream segment = segments.next();
    if (segment == null) {
      return false;
    }
    text = new QuoteTrackingReader(
        new InputStreamReader(segment, options.charset()), options.delimiter(), options.trimLeadingWhitespace());
    reader = CsvReader.builder()
        .fieldSeparator(options.delimiter())
        .quoteCharacter('"')
        .skipEmptyLines(true)
        .ignoreDifferentFieldCount(true)
        .acceptCharsAfterQuotes(false)
        .ofCsvRecord(text);
    rows = reader.iterator();
    log.debug("Decoding source {}", segments.segmentName());
    return true;
  }

  private RawRow nextRow() throws IOException, RecordParseException {
    if (rows == null) {
      return null;
    }
    try {
      if (!rows.hasNext()) {
        closeReader();
        return null;
      }
      CsvRecord raw = rows.next();
      long line = raw.getStartingLineNumber();
      List<String> fields = raw.getFields();
      Optional<QuoteTrackingReader.Fault> fault = text.faultWithin(line, lastLine(line, fields));
      if (fault.isPresent()) {
        throw new RecordParseException("malformed row: " + fault.get().reason(), segments.meta(), line);
      }
      return new RawRow(fields, segments.meta(), line);
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    } catch (CsvParseException ex) {
      Optional<QuoteTrackingReader.Fault> fault = text.firstFault();
      throw new RecordParseException(
          "malformed row: " + fault.map(QuoteTrackingReader.Fault::reason).orElse(ex.getMessage()),
          segments.meta(),
          fault.map(QuoteTrackingReader.Fault::line).orElse(0L),
          ex);
    }
  }

  /** Line a row ends on, counting the line breaks held inside its quoted fields. */
  private static long lastLine(long first, List<String> fields) {
    long line = first;
    for (String field : fields) {
      for (int i = 0; i < field.length(); i++) {
        char c = field.charAt(i);
        if (c == '\n' || (c == '\r' && (i + 1 == field.length() || field.charAt(i + 1) != '\n'))) {
          line++;
        }
      }
    }
    return line;
  }

  private void closeReader() {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (IOException ex) {
      log.debug("Ignoring failure closing row reader for {}", segments.segmentName(), ex);
    }
    reader = null;
    rows = null;
    text = null;
  }

  private record RawRow(List<String> fields, SourceMeta meta, long line) {}
}
