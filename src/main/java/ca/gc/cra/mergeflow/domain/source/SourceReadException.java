package ca.gc.cra.mergeflow.domain.source;

import java.io.IOException;
import java.util.Objects;

/**
 * Signals an I/O failure part way through a source. Raised only after every byte already read from the
 * source has been delivered to the consumer.
 *
 * @since 0.1.0
 */
public final class SourceReadException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String sourceName;
  private final long bytesDelivered;

  /**
   * Creates an exception naming the source whose read failed.
   *
   * @param sourceName display name of the failing source
   * @param bytesDelivered bytes of the source read successfully before the failure
   * @param cause underlying failure
   */
  public SourceReadException(String sourceName, long bytesDelivered, Throwable cause) {
    super("read " + Objects.requireNonNull(sourceName, "sourceName") + ": "
        + SourceOpenException.describe(cause), cause);
    this.sourceName = sourceName;
    this.bytesDelivered = bytesDelivered;
  }

  /**
   * Returns the display name of the source whose read failed.
   *
   * @return source name
   */
  public String sourceName() {
    return sourceName;
  }

  /**
   * Returns how many bytes of the source were read before the failure.
   *
   * @return byte count
   */
  public long bytesDelivered() {
    return bytesDelivered;
  }
}
