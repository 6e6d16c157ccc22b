package ca.gc.cra.mergeflow.domain.source;

import java.util.Objects;

/**
 * <strong>What:</strong> Snapshot of which source is active in a merged stream and how many of its bytes have
 * been delivered to the consumer.
 * <p><strong>Why:</strong> Lets downstream decoders attribute every byte and record back to the physical source
 * that produced it.</p>
 * <p><strong>Role:</strong> Domain value shared by the multiplexer and the record decoder.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to publish across threads.</p>
 *
 * @param name display name of the active source; empty before the first source begins
 * @param byteOffset bytes of the active source delivered so far; zero exactly when the source begins
 * @since 0.1.0
 */
public record SourceMeta(String name, long byteOffset) {
  /** Snapshot reported before any source has begun. */
  public static final SourceMeta NONE = new SourceMeta("", 0L);

  /**
   * Validates the snapshot.
   *
   * @throws NullPointerException if {@code name} is {@code null}
   * @throws IllegalArgumentException if {@code byteOffset} is negative
   */
  public SourceMeta {
    Objects.requireNonNull(name, "name");
    if (byteOffset < 0) {
      throw new IllegalArgumentException("byteOffset must be >= 0 (was " + byteOffset + ")");
    }
  }

  /**
   * Creates the boundary snapshot for a source that is about to begin.
   *
   * @param name source display name
   * @return snapshot with a zero offset
   */
  public static SourceMeta boundary(String name) {
    return new SourceMeta(name, 0L);
  }

  /**
   * Returns a snapshot of the same source advanced by {@code delivered} bytes.
   *
   * @param delivered number of additional bytes handed to the consumer; must be non-negative
   * @return advanced snapshot
   */
  public SourceMeta advance(long delivered) {
    if (delivered < 0) {
      throw new IllegalArgumentException("delivered must be >= 0 (was " + delivered + ")");
    }
    return delivered == 0 ? this : new SourceMeta(name, byteOffset + delivered);
  }

  /**
   * Indicates whether this snapshot marks the start of a source.
   *
   * @return {@code true} when a named source has not yet delivered any bytes
   */
  public boolean isBoundary() {
    return byteOffset == 0 && !name.isEmpty();
  }

  @Override
  public String toString() {
    return name + "@" + byteOffset;
  }
}
