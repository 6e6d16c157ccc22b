package ca.gc.cra.mergeflow.application.transform;

import ca.gc.cra.mergeflow.application.port.MappedIterator;
import ca.gc.cra.mergeflow.application.port.RecordDecoder;
import ca.gc.cra.mergeflow.application.port.RecordIterator;
import ca.gc.cra.mergeflow.application.port.RecordMapper;
import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.domain.record.RecordDecodingException;
import java.util.Objects;

/**
 * Composes a {@link RecordDecoder} with a {@link RecordMapper} so callers iterate typed values instead of raw
 * records.
 *
 * <p>Mapping happens lazily on each {@code next()}. The first mapper failure stops iteration and becomes the
 * iterator's sticky error; decoder failures propagate unchanged.</p>
 *
 * @param <T> mapped type
 * @since 0.1.0
 */
public final class DecodeMapTransform<T> {
  private final RecordDecoder decoder;
  private final RecordMapper<T> mapper;

  /**
   * Creates the transform.
   *
   * @param decoder record decoder; must not be {@code null}
   * @param mapper record mapper; must not be {@code null}
   */
  public DecodeMapTransform(RecordDecoder decoder, RecordMapper<T> mapper) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Decodes {@code stream} and maps every record.
   *
   * @param stream merged stream; owned by the returned iterator
   * @return mapped iterator
   * @throws RecordDecodingException if the decoder cannot start
   */
  public MappedIterator<T> apply(SourceAwareStream stream) throws RecordDecodingException {
    RecordIterator records = decoder.decode(Objects.requireNonNull(stream, "stream"));
    return new MappedRecordIterator<>(records, mapper);
  }
}
