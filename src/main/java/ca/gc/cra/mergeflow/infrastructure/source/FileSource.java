package ca.gc.cra.mergeflow.infrastructure.source;

import ca.gc.cra.mergeflow.application.port.Source;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Source} adapter over a regular file on a local or mounted filesystem.
 * <p><strong>Role:</strong> Infrastructure adapter produced by {@link FileSourceResolver}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link #open()} returns an independent stream.</p>
 * <p><strong>Performance:</strong> Defers all filesystem access until {@link #open()}.</p>
 *
 * @since 0.1.0
 */
public final class FileSource implements Source {
  private static final Logger log = LoggerFactory.getLogger(FileSource.class);

  private final Path path;
  private final String name;

  /**
   * Creates a file source named after the normalised path.
   *
   * @param path file location; must not be {@code null}
   */
  public FileSource(Path path) {
    this.path = Objects.requireNonNull(path, "path").normalize();
    this.name = this.path.toString();
  }

  @Override
  public String name() {
    return name;
  }

  public Path path() {
    return path;
  }

  /**
   * Opens the file for sequential reading.
   *
   * @return unbuffered stream over the file content
   * @throws NoSuchFileException if the file does not exist
   * @throws IOException if the path is not a regular file or cannot be read
   */
  @Override
  public InputStream open() throws IOException {
    if (!Files.exists(path)) {
      throw new NoSuchFileException(name);
    }
    if (!Files.isRegularFile(path)) {
      throw new IOException("not a regular file: " + name);
    }
    InputStream in = Files.newInputStream(path);
    log.debug("Opened file {} ({} bytes)", name, Files.size(path));
    return in;
  }

  @Override
  public String toString() {
    return "FileSource[" + name + "]";
  }
}
