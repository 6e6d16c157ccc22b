package ca.gc.cra.mergeflow.domain.source;

import java.io.IOException;
import java.util.Objects;

/**
 * Signals that a source could not be opened; aborts the whole merged stream.
 *
 * @since 0.1.0
 */
public final class SourceOpenException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String sourceName;

  /**
   * Creates an exception naming the source that failed to open.
   *
   * @param sourceName display name of the failing source
   * @param cause underlying failure
   */
  public SourceOpenException(String sourceName, Throwable cause) {
    super("open " + Objects.requireNonNull(sourceName, "sourceName") + ": " + describe(cause), cause);
    this.sourceName = sourceName;
  }

  /**
   * Returns the display name of the source that failed to open.
   *
   * @return source name
   */
  public String sourceName() {
    return sourceName;
  }

  static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
