package ca.gc.cra.mergeflow.infrastructure.mux;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MultiplexerSettingsTest {

  @Test
  void defaultsUseSingleChunkHandoff() {
    MultiplexerSettings settings = MultiplexerSettings.defaults();
    assertEquals(32 * 1024, settings.chunkSize());
    assertEquals(1, settings.handoffDepth());
    assertEquals("mergeflow-mux", settings.threadPrefix());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> MultiplexerSettings.defaults().withChunkSize(0));
    assertThrows(IllegalArgumentException.class, () -> MultiplexerSettings.defaults().withHandoffDepth(0));
    assertThrows(IllegalArgumentException.class,
        () -> MultiplexerSettings.defaults().withHandoffDepth(MultiplexerSettings.MAX_HANDOFF_DEPTH + 1));
  }
}
