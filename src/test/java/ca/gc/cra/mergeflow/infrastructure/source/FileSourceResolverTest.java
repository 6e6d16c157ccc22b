package ca.gc.cra.mergeflow.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mergeflow.application.port.Source;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSourceResolverTest {

  @TempDir
  Path dir;

  @Test
  void plainPathsAndWindowsPathsAreUnchanged() throws Exception {
    assertEquals("data/a.csv", FileSourceResolver.normalize("data/a.csv"));
    assertEquals("C:\\data\\x.csv", FileSourceResolver.normalize("C:\\data\\x.csv"));
    assertEquals("\\\\server\\share\\x.csv", FileSourceResolver.normalize("\\\\server\\share\\x.csv"));
    assertEquals("a+b.csv", FileSourceResolver.normalize("a+b.csv"));
  }

  @Test
  void fileUrlsAreDecoded() throws Exception {
    assertEquals(local("/tmp/a b.csv"), FileSourceResolver.normalize("file:///tmp/a%20b.csv"));
    assertEquals(local("/tmp/a+b.csv"), FileSourceResolver.normalize("file:///tmp/a+b.csv"));
    assertEquals(local("/tmp/x.csv"), FileSourceResolver.normalize("file://localhost/tmp/x.csv"));
    assertEquals(local("/tmp/x.csv"), FileSourceResolver.normalize("file:/tmp/x.csv"));
    assertEquals(local("./rel.csv"), FileSourceResolver.normalize("file:./rel.csv"));
    assertEquals(local("C:/data/x.csv"), FileSourceResolver.normalize("file:///C:/data/x.csv"));
    assertEquals(local("//server/share/x.csv"), FileSourceResolver.normalize("file://server/share/x.csv"));
  }

  @Test
  void rejectsOtherSchemesAndMalformedUrls() {
    IOException scheme = assertThrows(IOException.class, () -> FileSourceResolver.normalize("http://host/x.csv"));
    assertTrue(scheme.getMessage().startsWith("unsupported scheme \"http\""), scheme.getMessage());
    assertThrows(IOException.class, () -> FileSourceResolver.normalize("file:///bad%zzname"));
    assertThrows(IOException.class, () -> FileSourceResolver.normalize("file:"));
    assertThrows(IllegalArgumentException.class, () -> FileSourceResolver.normalize("   "));
  }

  @Test
  void globMatchesAreSortedByPath() throws Exception {
    write("b.csv", "b");
    write("a.csv", "a");
    write("notes.txt", "n");
    write("nested/c.csv", "c");

    FileSourceResolver resolver = new FileSourceResolver(dir);

    assertEquals(List.of("a.csv", "b.csv"), fileNames(resolver.resolve("*.csv")));
    assertEquals(List.of("a.csv", "b.csv", "c.csv"), fileNames(resolver.resolve("**.csv")));
  }

  @Test
  void literalPathResolvesToOneSource() throws Exception {
    write("only.csv", "hello");
    List<Source> sources = new FileSourceResolver(dir).resolve("only.csv");

    assertEquals(1, sources.size());
    assertEquals(dir.resolve("only.csv").toAbsolutePath().normalize().toString(), sources.get(0).name());
    try (InputStream in = sources.get(0).open()) {
      assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void absoluteFileUrlResolves() throws Exception {
    Path file = write("url name.csv", "x");
    String url = file.toUri().toString();
    List<Source> sources = new FileSourceResolver().resolve(url);
    assertEquals(List.of("url name.csv"), fileNames(sources));
  }

  @Test
  void noMatchesIsAnError() {
    IOException ex = assertThrows(IOException.class, () -> new FileSourceResolver(dir).resolve("*.psv"));
    assertTrue(ex.getMessage().startsWith("no files matched"), ex.getMessage());
  }

  @Test
  void fileSourceReportsMissingFileOnOpen() {
    FileSource source = new FileSource(dir.resolve("gone.csv"));
    assertThrows(NoSuchFileException.class, source::open);
  }

  private Path write(String relative, String content) throws IOException {
    Path file = dir.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  private static List<String> fileNames(List<Source> sources) {
    return sources.stream()
        .map(source -> ((FileSource) source).path().getFileName().toString())
        .collect(Collectors.toList());
  }

  private static String local(String path) {
    return path.replace('/', File.separatorChar);
  }
}
