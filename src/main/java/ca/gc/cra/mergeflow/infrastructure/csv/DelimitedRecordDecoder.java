package ca.gc.cra.mergeflow.infrastructure.csv;

import ca.gc.cra.mergeflow.application.port.MetricsPort;
import ca.gc.cra.mergeflow.application.port.RecordDecoder;
import ca.gc.cra.mergeflow.application.port.RecordIterator;
import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.domain.record.HeaderConfigurationException;
import java.util.Objects;

/**
 * <strong>What:</strong> Boundary-aware decoder for delimited text (RFC 4180 quoting) spread over many sources.
 * <p><strong>Why:</strong> Physical files commonly repeat the header; the merged stream must expose it once.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link RecordDecoder} on top of FastCSV.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Adopt the configured header, or infer it from the first row of the stream.</li>
 *   <li>Drop rows equal to the header at the start of every source; keep any other first row.</li>
 *   <li>Reject rows whose field count differs from the header.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; every {@link #decode(SourceAwareStream)} call creates an
 * independent session.</p>
 *
 * @since 0.1.0
 */
public final class DelimitedRecordDecoder implements RecordDecoder {
  private final DecoderOptions options;
  private final MetricsPort metrics;

  /**
   * Creates a decoder with default options: comma delimiter, inferred header, UTF-8.
   */
  public DelimitedRecordDecoder() {
    this(DecoderOptions.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a decoder.
   *
   * @param options delimiter, header, and charset
   * @param metrics metrics sink for decode counters
   */
  public DelimitedRecordDecoder(DecoderOptions options, MetricsPort metrics) {
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts a decode session. Inferring the header reads the first row of the stream before returning.
   *
   * @param stream merged stream; owned by the returned iterator
   * @return record iterator
   * @throws HeaderConfigurationException if the header has duplicate names or no row exists to infer it from
   */
  @Override
  public RecordIterator decode(SourceAwareStream stream) throws HeaderConfigurationException {
    return DelimitedRecordIterator.start(stream, options, metrics);
  }

  public DecoderOptions options() {
    return options;
  }
}
