package ca.gc.cra.mergeflow.infrastructure.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import ca.gc.cra.mergeflow.infrastructure.mux.MultiplexerSettings;
import ca.gc.cra.mergeflow.infrastructure.mux.SourceMultiplexer;
import ca.gc.cra.mergeflow.infrastructure.source.InMemorySource;
import ca.gc.cra.mergeflow.support.RecordingMetricsPort;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceSegmentsTest {

  @Test
  void splitsMergedStreamPerSourceEvenWhenNamesRepeat() throws Exception {
    try (SourceMultiplexer mux = SourceMultiplexer.start(
        List.of(
            InMemorySource.ofText("dup", "first"),
            InMemorySource.ofText("dup", "second"),
            InMemorySource.ofText("", ""),
            InMemorySource.ofText("tail", "end")),
        MultiplexerSettings.defaults().withChunkSize(3),
        new RecordingMetricsPort())) {
      SourceSegments segments = new SourceSegments(mux, 4);

      assertEquals("first", text(segments.next()));
      assertEquals(new SourceMeta("dup", 5), segments.meta());
      assertEquals("second", text(segments.next()));
      assertEquals("end", text(segments.next()));
      assertEquals("tail", segments.segmentName());
      assertNull(segments.next());
    }
  }

  @Test
  void unreadRemainderIsSkippedWhenMovingOn() throws Exception {
    try (SourceMultiplexer mux = SourceMultiplexer.start(List.of(
        InMemorySource.ofText("a", "abcdef"), InMemorySource.ofText("b", "xyz")))) {
      SourceSegments segments = new SourceSegments(mux);
      InputStream first = segments.next();
      assertEquals('a', first.read());
      assertEquals("xyz", text(segments.next()));
      assertEquals(-1, first.read());
    }
  }

  private static String text(InputStream segment) throws Exception {
    return new String(segment.readAllBytes(), StandardCharsets.UTF_8);
  }
}
