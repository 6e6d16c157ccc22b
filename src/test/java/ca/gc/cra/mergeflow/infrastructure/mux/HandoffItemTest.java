package ca.gc.cra.mergeflow.infrastructure.mux;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mergeflow.infrastructure.buffer.BufferPool;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class HandoffItemTest {

  @Test
  void itemsValidateTheirComponents() {
    assertThrows(NullPointerException.class, () -> new HandoffItem.Boundary(null));
    assertThrows(NullPointerException.class, () -> new HandoffItem.Failure(null));

    BufferPool pool = new BufferPool(4, 1);
    BufferPool.PooledBuffer buffer = pool.acquire();
    assertThrows(IllegalArgumentException.class, () -> new HandoffItem.Chunk(buffer, 0));
    buffer.close();
  }

  @Test
  void discardingAChunkReleasesItsBuffer() {
    BufferPool pool = new BufferPool(4, 1);
    HandoffItem.Chunk chunk = new HandoffItem.Chunk(pool.acquire(), 3);
    assertEquals(4, chunk.data().length);

    chunk.discard();

    assertTrue(chunk.buffer().isReleased());
  }

  @Test
  void failureCarriesItsError() {
    IOException error = new IOException("device error");
    assertSame(error, new HandoffItem.Failure(error).error());
    assertEquals("a", new HandoffItem.Boundary("a").name());
  }
}
