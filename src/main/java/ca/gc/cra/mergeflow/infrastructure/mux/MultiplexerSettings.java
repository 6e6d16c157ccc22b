package ca.gc.cra.mergeflow.infrastructure.mux;

import ca.gc.cra.mergeflow.validation.Numbers;
import java.util.Objects;

/**
 * Tuning for {@link SourceMultiplexer}.
 *
 * @param chunkSize bytes read from a source per chunk
 * @param handoffDepth chunks (and boundary markers) allowed in flight between producer and consumer
 * @param threadPrefix name prefix for the producer thread
 * @since 0.1.0
 */
public record MultiplexerSettings(int chunkSize, int handoffDepth, String threadPrefix) {
  public static final int DEFAULT_CHUNK_SIZE = 32 * 1024;
  public static final int DEFAULT_HANDOFF_DEPTH = 1;
  public static final int MAX_CHUNK_SIZE = 16 * 1024 * 1024;
  public static final int MAX_HANDOFF_DEPTH = 1024;
  public static final String DEFAULT_THREAD_PREFIX = "mergeflow-mux";

  public MultiplexerSettings {
    Numbers.requireRange("chunkSize", chunkSize, 1, MAX_CHUNK_SIZE);
    Numbers.requireRange("handoffDepth", handoffDepth, 1, MAX_HANDOFF_DEPTH);
    Objects.requireNonNull(threadPrefix, "threadPrefix");
  }

  /**
   * Returns the settings used when none are supplied: 32 KiB chunks and a single chunk in flight.
   *
   * @return default settings
   */
  public static MultiplexerSettings defaults() {
    return new MultiplexerSettings(DEFAULT_CHUNK_SIZE, DEFAULT_HANDOFF_DEPTH, DEFAULT_THREAD_PREFIX);
  }

  public MultiplexerSettings withChunkSize(int size) {
    return new MultiplexerSettings(size, handoffDepth, threadPrefix);
  }

  public MultiplexerSettings withHandoffDepth(int depth) {
    return new MultiplexerSettings(chunkSize, depth, threadPrefix);
  }
}
