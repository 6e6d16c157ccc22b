package ca.gc.cra.mergeflow.infrastructure.csv;

import ca.gc.cra.mergeflow.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for {@link DelimitedRecordDecoder}.
 *
 * @param delimiter single-character field delimiter
 * @param header explicit canonical header, or {@code null} to infer it from the first row of the stream
 * @param charset text encoding of every source
 * @param trimLeadingWhitespace whether whitespace at the start of a field, including before an opening quote, is
 *     dropped; text inside quotes is kept as written
 * @since 0.1.0
 */
public record DecoderOptions(
    char delimiter, List<String> header, Charset charset, boolean trimLeadingWhitespace) {

  public static final char DEFAULT_DELIMITER = ',';

  public DecoderOptions {
    Strings.requireDelimiter("delimiter", delimiter);
    header = header == null ? null : List.copyOf(header);
    Objects.requireNonNull(charset, "charset");
  }

  /**
   * Comma-delimited UTF-8 input with an inferred header and leading whitespace trimmed.
   *
   * @return default options
   */
  public static DecoderOptions defaults() {
    return new DecoderOptions(DEFAULT_DELIMITER, null, StandardCharsets.UTF_8, true);
  }

  public DecoderOptions withDelimiter(char value) {
    return new DecoderOptions(value, header, charset, trimLeadingWhitespace);
  }

  public DecoderOptions withHeader(List<String> names) {
    return new DecoderOptions(delimiter, Objects.requireNonNull(names, "names"), charset, trimLeadingWhitespace);
  }

  public DecoderOptions withCharset(Charset value) {
    return new DecoderOptions(delimiter, header, value, trimLeadingWhitespace);
  }

  public DecoderOptions withTrimLeadingWhitespace(boolean value) {
    return new DecoderOptions(delimiter, header, charset, value);
  }

  /**
   * Returns the explicit header, if one was configured.
   *
   * @return explicit header names, or empty when the header is inferred
   */
  public Optional<List<String>> explicitHeader() {
    return Optional.ofNullable(header);
  }
}
