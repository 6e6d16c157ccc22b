package ca.gc.cra.mergeflow.infrastructure.mux;

import ca.gc.cra.mergeflow.infrastructure.buffer.BufferPool;
import java.io.IOException;
import java.util.Objects;

/**
 * Items passed from the multiplexer's producer thread to its consumer, in order.
 */
sealed interface HandoffItem
    permits HandoffItem.Boundary, HandoffItem.Chunk, HandoffItem.End, HandoffItem.Failure,
        HandoffItem.Closed {

  /** Returns pooled resources held by the item; called when the item is dropped unconsumed. */
  default void discard() {}

  /** Marks the start of a source; the consumer resets its provenance snapshot. */
  record Boundary(String name) implements HandoffItem {
    public Boundary {
      Objects.requireNonNull(name, "name");
    }
  }

  /** Bytes read from the current source, held in a pooled buffer until drained. */
  record Chunk(BufferPool.PooledBuffer buffer, int length) implements HandoffItem {
    public Chunk {
      Objects.requireNonNull(buffer, "buffer");
      if (length <= 0) {
        throw new IllegalArgumentException("length must be positive");
      }
    }

    byte[] data() {
      return buffer.borrowWritableArray();
    }

    @Override
    public void discard() {
      buffer.close();
    }
  }

  /** Clean end of the merged stream. */
  enum End implements HandoffItem {
    INSTANCE
  }

  /** Terminal open or read failure. */
  record Failure(IOException error) implements HandoffItem {
    public Failure {
      Objects.requireNonNull(error, "error");
    }
  }

  /** Wakes a blocked consumer after {@link SourceMultiplexer#close()}. */
  enum Closed implements HandoffItem {
    INSTANCE
  }
}
