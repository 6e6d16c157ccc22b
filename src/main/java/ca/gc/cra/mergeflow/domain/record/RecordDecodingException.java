package ca.gc.cra.mergeflow.domain.record;

/**
 * Base type for failures raised while turning a merged byte stream into records.
 *
 * @since 0.1.0
 */
public class RecordDecodingException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a decoding failure.
   *
   * @param message description of the failure
   */
  public RecordDecodingException(String message) {
    super(message);
  }

  /**
   * Creates a decoding failure with an underlying cause.
   *
   * @param message description of the failure
   * @param cause underlying failure
   */
  public RecordDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
