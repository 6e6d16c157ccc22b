package ca.gc.cra.mergeflow.infrastructure.buffer;

import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable byte arrays backing the multiplexer's chunk handoff.
 *
 * <p>Buffers are borrowed by the producer thread and returned by the consumer thread once a chunk has been
 * drained, so the pool is guarded by a lock.</p>
 */
public final class BufferPool {
  private final int bufferSize;
  private final int maxPoolSize;
  private final ArrayDeque<byte[]> pool;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates a buffer pool with the desired buffer size and maximum cached entries.
   *
   * @param bufferSize size of each pooled buffer in bytes
   * @param maxPoolSize maximum number of buffers kept in the pool
   */
  public BufferPool(int bufferSize, int maxPoolSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be positive");
    }
    this.bufferSize = bufferSize;
    this.maxPoolSize = maxPoolSize;
    this.pool = new ArrayDeque<>(maxPoolSize);
  }

  /**
   * Borrows a buffer from the pool, creating one when the pool is empty.
   *
   * @return pooled buffer wrapper ready for use
   */
  public PooledBuffer acquire() {
    byte[] data;
    lock.lock();
    try {
      data = pool.pollFirst();
    } finally {
      lock.unlock();
    }
    if (data == null) {
      data = new byte[bufferSize];
    }
    return new PooledBuffer(this, data);
  }

  /**
   * Returns the size of every buffer handed out by this pool.
   *
   * @return buffer size in bytes
   */
  public int bufferSize() {
    return bufferSize;
  }

  int idleCount() {
    lock.lock();
    try {
      return pool.size();
    } finally {
      lock.unlock();
    }
  }

  void release(byte[] data) {
    if (data == null || data.length != bufferSize) {
      return;
    }
    lock.lock();
    try {
      if (pool.size() < maxPoolSize) {
        pool.addFirst(data);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Encapsulates a borrowed buffer and returns it to the pool when closed. Ownership may move between threads
   * as long as only one thread touches it at a time.
   */
  public static final class PooledBuffer implements AutoCloseable {
    private final BufferPool owner;
    private byte[] data;
    private boolean released;

    private PooledBuffer(BufferPool owner, byte[] data) {
      this.owner = owner;
      this.data = data;
    }

    /**
     * Provides the mutable backing array for zero-copy reads and writes.
     *
     * @return writable backing array (do not retain after close)
     */
    public byte[] borrowWritableArray() {
      if (released) {
        throw new IllegalStateException("buffer already released");
      }
      return data;
    }

    public boolean isReleased() {
      return released;
    }

    @Override
    public void close() {
      if (released) {
        return;
      }
      owner.release(data);
      released = true;
      data = null;
    }
  }
}
