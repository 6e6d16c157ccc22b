package ca.gc.cra.mergeflow.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceRegistryTest {

  @TempDir Path tempDir;

  private static final SourceResolver MEMORY = spec -> List.of(InMemorySource.ofText(spec, "x"));

  @Test
  void detectsSchemes() {
    assertEquals("file", SourceRegistry.detectScheme("data/*.csv"));
    assertEquals("file", SourceRegistry.detectScheme("C:\\data\\x.csv"));
    assertEquals("file", SourceRegistry.detectScheme("FILE:///tmp/x.csv"));
    assertEquals("s3", SourceRegistry.detectScheme("S3://bucket/key.csv"));
    assertNull(SourceRegistry.detectScheme("1bad://x"));
  }

  @Test
  void dispatchesToRegisteredResolver() throws Exception {
    SourceRegistry registry = SourceRegistry.builder().register("mem", MEMORY).build();
    List<Source> sources = registry.resolve("mem://one");
    assertEquals(List.of("mem://one"), sources.stream().map(Source::name).collect(Collectors.toList()));
    assertEquals(Set.of("mem"), registry.schemes());
  }

  @Test
  void distinguishesUnknownAndUnregisteredSchemes() {
    SourceRegistry registry = SourceRegistry.withDefaults(tempDir);

    IOException unknown = assertThrows(IOException.class, () -> registry.resolve("1bad://x"));
    assertTrue(unknown.getMessage().startsWith("unknown scheme"), unknown.getMessage());

    IOException unregistered = assertThrows(IOException.class, () -> registry.resolve("ftp://host/x.csv"));
    assertTrue(unregistered.getMessage().startsWith("no source resolver registered for scheme \"ftp\""),
        unregistered.getMessage());
  }

  @Test
  void rejectsDuplicateAndMalformedRegistrations() {
    SourceRegistry.Builder builder = SourceRegistry.builder().register("mem", MEMORY);
    assertThrows(IllegalArgumentException.class, () -> builder.register("MEM", MEMORY));
    assertThrows(IllegalArgumentException.class, () -> builder.register("9x", MEMORY));
  }

  @Test
  void resolveAllKeepsSpecificationOrder() throws Exception {
    Files.writeString(tempDir.resolve("z.csv"), "z");
    Files.writeString(tempDir.resolve("a.csv"), "a");
    SourceRegistry registry = SourceRegistry.withDefaults(tempDir);

    List<Source> sources = registry.resolveAll(List.of("z.csv", "a.csv"));

    assertEquals(2, sources.size());
    assertTrue(sources.get(0).name().endsWith("z.csv"));
    assertTrue(sources.get(1).name().endsWith("a.csv"));
  }
}
