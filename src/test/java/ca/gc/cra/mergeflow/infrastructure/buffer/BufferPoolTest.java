package ca.gc.cra.mergeflow.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BufferPoolTest {

  @Test
  void releasedArraysAreReused() {
    BufferPool pool = new BufferPool(16, 2);
    BufferPool.PooledBuffer first = pool.acquire();
    byte[] array = first.borrowWritableArray();
    first.close();

    assertTrue(first.isReleased());
    assertEquals(1, pool.idleCount());
    assertSame(array, pool.acquire().borrowWritableArray());
  }

  @Test
  void idleArraysAreCapped() {
    BufferPool pool = new BufferPool(8, 1);
    BufferPool.PooledBuffer a = pool.acquire();
    BufferPool.PooledBuffer b = pool.acquire();
    a.close();
    b.close();
    b.close();
    assertEquals(1, pool.idleCount());
  }

  @Test
  void releasedBufferCannotBeBorrowed() {
    BufferPool.PooledBuffer buffer = new BufferPool(4, 1).acquire();
    buffer.close();
    assertThrows(IllegalStateException.class, buffer::borrowWritableArray);
  }

  @Test
  void rejectsNonPositiveSizes() {
    assertThrows(IllegalArgumentException.class, () -> new BufferPool(0, 1));
    assertThrows(IllegalArgumentException.class, () -> new BufferPool(1, 0));
  }
}
