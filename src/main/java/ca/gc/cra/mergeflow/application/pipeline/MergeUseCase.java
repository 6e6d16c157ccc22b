package ca.gc.cra.mergeflow.application.pipeline;

import ca.gc.cra.mergeflow.application.port.MappedIterator;
import ca.gc.cra.mergeflow.application.port.MetricsPort;
import ca.gc.cra.mergeflow.application.port.RecordDecoder;
import ca.gc.cra.mergeflow.application.port.RecordIterator;
import ca.gc.cra.mergeflow.application.port.RecordMapper;
import ca.gc.cra.mergeflow.application.port.RecordSink;
import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.application.port.SourceResolver;
import ca.gc.cra.mergeflow.application.port.SourceStreamFactory;
import ca.gc.cra.mergeflow.application.transform.DecodeMapTransform;
import ca.gc.cra.mergeflow.domain.record.RecordDecodingException;
import ca.gc.cra.mergeflow.domain.record.RecordView;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Resolves source specifications, merges the sources into one stream and decodes it
 * into records.
 * <p><strong>Why:</strong> Gives callers a single entry point from a list of paths or globs to a record cursor.</p>
 * <p><strong>Role:</strong> Application use case wired by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; each call starts an
 * independent run.</p>
 * <p><strong>Observability:</strong> Tags log lines with the MDC key {@code source} while a record is handed to
 * a sink and records {@code merge.runs}, {@code merge.records} and {@code merge.failures}.</p>
 *
 * @since 0.1.0
 */
public final class MergeUseCase {
  private static final Logger log = LoggerFactory.getLogger(MergeUseCase.class);
  static final String MDC_SOURCE = "source";

  private final List<String> specs;
  private final SourceResolver resolver;
  private final SourceStreamFactory streams;
  private final RecordDecoder decoder;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param specs ordered source specifications (paths, globs or scheme-qualified locations)
   * @param resolver expands each specification into sources
   * @param streams starts merged streams
   * @param decoder decodes merged streams into records
   * @param metrics metrics sink
   * @throws NullPointerException if any argument is {@code null}
   */
  public MergeUseCase(
      List<String> specs,
      SourceResolver resolver,
      SourceStreamFactory streams,
      RecordDecoder decoder,
      MetricsPort metrics) {
    this.specs = List.copyOf(Objects.requireNonNull(specs, "specs"));
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.streams = Objects.requireNonNull(streams, "streams");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Expands every specification, in order, into sources.
   *
   * @return ordered sources
   * @throws IOException if a specification cannot be resolved
   */
  public List<Source> resolveSources() throws IOException {
    List<Source> sources = new ArrayList<>();
    for (String spec : specs) {
      List<Source> resolved = resolver.resolve(spec);
      log.debug("Resolved {} to {} sources", spec, resolved.size());
      sources.addAll(resolved);
    }
    return sources;
  }

  /**
   * Starts a merge and returns the record cursor. The caller must close it.
   *
   * @return record iterator over every resolved source
   * @throws IOException if a specification cannot be resolved
   * @throws RecordDecodingException if no canonical header can be established
   */
  public RecordIterator open() throws IOException, RecordDecodingException {
    List<Source> sources = resolveSources();
    metrics.increment("merge.runs");
    log.info("Merging {} sources", sources.size());
    return decoder.decode(streams.open(sources));
  }

  /**
   * Starts a merge whose records are mapped to typed values. The caller must close the result.
   *
   * @param mapper record mapper
   * @param <T> mapped type
   * @return mapped iterator
   * @throws IOException if a specification cannot be resolved
   * @throws RecordDecodingException if no canonical header can be established
   */
  public <T> MappedIterator<T> open(RecordMapper<T> mapper) throws IOException, RecordDecodingException {
    DecodeMapTransform<T> transform = new DecodeMapTransform<>(decoder, mapper);
    List<Source> sources = resolveSources();
    metrics.increment("merge.runs");
    log.info("Merging {} sources with mapper", sources.size());
    SourceAwareStream stream = streams.open(sources);
    return transform.apply(stream);
  }

  /**
   * Runs a merge to completion, handing every record to {@code sink}.
   *
   * @param sink record consumer
   * @return number of records delivered
   * @throws Exception if resolution, decoding or the sink fails
   */
  public long run(RecordSink sink) throws Exception {
    Objects.requireNonNull(sink, "sink");
    long delivered = 0;
    try (RecordIterator records = open()) {
      while (records.next()) {
        RecordView record = records.record();
        String previous = MDC.get(MDC_SOURCE);
        try {
          MDC.put(MDC_SOURCE, record.meta().name());
          sink.accept(record);
        } finally {
          if (previous == null) {
            MDC.remove(MDC_SOURCE);
          } else {
            MDC.put(MDC_SOURCE, previous);
          }
        }
        delivered++;
      }
      Optional<Exception> error = records.error();
      if (error.isPresent()) {
        throw error.get();
      }
    } catch (Exception ex) {
      metrics.increment("merge.failures");
      log.error("Merge failed after {} records", delivered, ex);
      throw ex;
    } finally {
      metrics.observe("merge.records", delivered);
    }
    log.info("Merge completed with {} records", delivered);
    return delivered;
  }
}
