package ca.gc.cra.mergeflow.infrastructure.source;

import ca.gc.cra.mergeflow.application.port.Source;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link Source} backed by an in-memory byte array. Useful for synthetic inputs and tests.
 *
 * @since 0.1.0
 */
public final class InMemorySource implements Source {
  private final String name;
  private final byte[] data;

  /**
   * Creates a source over a copy of {@code data}.
   *
   * @param name display name
   * @param data payload; copied
   */
  public InMemorySource(String name, byte[] data) {
    this.name = Objects.requireNonNull(name, "name");
    this.data = Objects.requireNonNull(data, "data").clone();
  }

  /**
   * Creates a source over the UTF-8 encoding of {@code text}.
   *
   * @param name display name
   * @param text payload
   * @return new source
   */
  public static InMemorySource ofText(String name, String text) {
    return new InMemorySource(name, Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public InputStream open() {
    return new ByteArrayInputStream(data);
  }

  public int size() {
    return data.length;
  }

  @Override
  public String toString() {
    return "InMemorySource[" + name + ", " + data.length + " bytes]";
  }
}
