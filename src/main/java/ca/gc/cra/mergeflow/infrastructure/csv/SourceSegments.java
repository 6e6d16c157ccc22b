package ca.gc.cra.mergeflow.infrastructure.csv;

import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Splits a merged {@link SourceAwareStream} back into one input stream per source.
 *
 * <p>After every read the stream's provenance snapshot is compared with the previous one: a changed source
 * name, or bytes that begin at offset zero, open a new source. Each segment reports end-of-stream at the next
 * such boundary, so a parser working on a segment never sees bytes of two sources.</p>
 *
 * <p>Not thread-safe; owned by one decode session.</p>
 */
final class SourceSegments {
  private static final int READ_SIZE = 8 * 1024;

  private final SourceAwareStream stream;
  private final byte[] buffer;
  private int position;
  private int limit;
  private boolean streamEnded;
  private boolean startsSource;
  private String lastName;
  private String bufferedName = "";
  private String segmentName = "";
  private long segmentOffset;
  private Segment active;

  SourceSegments(SourceAwareStream stream) {
    this(stream, READ_SIZE);
  }

  SourceSegments(SourceAwareStream stream, int readSize) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.buffer = new byte[readSize];
  }

  /**
   * Moves to the next source that has bytes, skipping whatever is left of the current one.
   *
   * @return stream over the next source's bytes, or {@code null} once the merged stream is exhausted
   * @throws IOException if the merged stream fails
   */
  InputStream next() throws IOException {
    if (active != null) {
      active.skipRemaining();
      active = null;
    }
    if (position == limit && !fill()) {
      return null;
    }
    startsSource = false;
    segmentName = bufferedName;
    segmentOffset = 0;
    active = new Segment();
    return active;
  }

  /**
   * Returns the provenance of the bytes handed to the parser so far.
   *
   * @return current segment's name and consumed byte count
   */
  SourceMeta meta() {
    return new SourceMeta(segmentName, segmentOffset);
  }

  String segmentName() {
    return segmentName;
  }

  private boolean fill() throws IOException {
    if (streamEnded) {
      return false;
    }
    int n;
    do {
      n = stream.read(buffer, 0, buffer.length);
    } while (n == 0);
    if (n < 0) {
      streamEnded = true;
      position = 0;
      limit = 0;
      return false;
    }
    SourceMeta meta = stream.current();
    startsSource = lastName == null
        || !meta.name().equals(lastName)
        || meta.byteOffset() - n == 0;
    lastName = meta.name();
    bufferedName = meta.name();
    position = 0;
    limit = n;
    return true;
  }

  private final class Segment extends InputStream {
    private boolean finished;

    @Override
    public int read() throws IOException {
      byte[] one = new byte[1];
      int n = read(one, 0, 1);
      return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException {
      Objects.checkFromIndexSize(offset, length, target.length);
      if (finished) {
        return -1;
      }
      if (length == 0) {
        return 0;
      }
      if (position == limit && (!fill() || startsSource)) {
        finished = true;
        return -1;
      }
      int n = Math.min(length, limit - position);
      System.arraycopy(buffer, position, target, offset, n);
      position += n;
      segmentOffset += n;
      return n;
    }

    void skipRemaining() throws IOException {
      byte[] scratch = new byte[READ_SIZE];
      while (read(scratch, 0, scratch.length) >= 0) {
        // discard
      }
    }

    @Override
    public void close() {
      // The merged stream is owned by the decode session.
    }
  }
}
