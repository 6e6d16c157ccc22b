package ca.gc.cra.mergeflow.infrastructure.mux;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot mailbox whose publisher never blocks: a new value overwrites any unread one.
 *
 * <p>Readers block until a value is present or the mailbox is closed. Closing discards the unread value, so
 * every read after close reports end-of-stream without blocking.</p>
 *
 * @param <T> value type
 */
final class CoalescingMailbox<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private T value;
  private boolean closed;

  /**
   * Publishes a value, replacing any unread one.
   *
   * @param next value to publish
   * @return {@code false} if the mailbox is already closed and the value was dropped
   */
  boolean publish(T next) {
    Objects.requireNonNull(next, "next");
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      value = next;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  Optional<T> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (value == null && !closed) {
        changed.await();
      }
      return drain();
    } finally {
      lock.unlock();
    }
  }

  Optional<T> take(Duration timeout) throws InterruptedException, TimeoutException {
    Objects.requireNonNull(timeout, "timeout");
    long remaining = toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (value == null && !closed) {
        if (remaining <= 0L) {
          throw new TimeoutException("no source boundary within " + timeout);
        }
        remaining = changed.awaitNanos(remaining);
      }
      return drain();
    } finally {
      lock.unlock();
    }
  }

  /** Discards any unread value and wakes every waiter. Idempotent. */
  void close() {
    lock.lock();
    try {
      closed = true;
      value = null;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  private Optional<T> drain() {
    T taken = value;
    value = null;
    return Optional.ofNullable(taken);
  }

  private static long toNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException ex) {
      return timeout.isNegative() ? 0L : TimeUnit.DAYS.toNanos(365L * 100);
    }
  }
}
