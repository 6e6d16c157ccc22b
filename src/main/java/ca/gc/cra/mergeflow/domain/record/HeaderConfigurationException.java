package ca.gc.cra.mergeflow.domain.record;

/**
 * Raised when no usable canonical header can be established: duplicate field names, or no row to infer
 * one from.
 *
 * @since 0.1.0
 */
public final class HeaderConfigurationException extends RecordDecodingException {
  private static final long serialVersionUID = 1L;

  public HeaderConfigurationException(String message) {
    super(message);
  }

  public HeaderConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
