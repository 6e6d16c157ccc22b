package ca.gc.cra.mergeflow.infrastructure.mux;

import ca.gc.cra.mergeflow.application.port.MetricsPort;
import ca.gc.cra.mergeflow.application.port.Source;
import ca.gc.cra.mergeflow.application.port.SourceAwareStream;
import ca.gc.cra.mergeflow.domain.source.SourceMeta;
import ca.gc.cra.mergeflow.domain.source.SourceOpenException;
import ca.gc.cra.mergeflow.domain.source.SourceReadException;
import ca.gc.cra.mergeflow.infrastructure.buffer.BufferPool;
import ca.gc.cra.mergeflow.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges an ordered list of sources into one byte stream while tracking which source
 * every byte came from.
 * <p><strong>Why:</strong> Lets record decoders treat many physical files as one logical input without losing
 * provenance or per-source boundaries.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link SourceAwareStream}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open sources one at a time in list order on a background producer; at most one handle is open.</li>
 *   <li>Publish a boundary {@code (name, 0)} to a coalescing mailbox before any byte of a source is read.</li>
 *   <li>Hand bytes to the consumer through a bounded queue of pooled chunks (backpressure).</li>
 *   <li>Deliver bytes already read from a source before surfacing that source's read failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One consumer thread calls {@code read}/{@code awaitBoundary};
 * {@link #current()} and {@link #close()} are safe from any thread.</p>
 * <p><strong>Performance:</strong> Memory is bounded by {@code (handoffDepth + 2) * chunkSize}, independent of
 * the merged stream's length.</p>
 * <p><strong>Observability:</strong> Emits {@code mux.source.opened}, {@code mux.source.completed},
 * {@code mux.source.failed}, {@code mux.source.bytes} and {@code mux.handoff.waitNanos}.</p>
 *
 * @implNote Provenance is advanced on the consumer side as bytes are handed out and a single read never spans
 * two sources, so {@link #current()} read right after a {@code read} describes exactly the returned bytes.
 * @since 0.1.0
 */
public final class SourceMultiplexer extends InputStream implements SourceAwareStream {
  private static final Logger log = LoggerFactory.getLogger(SourceMultiplexer.class);

  private final List<Source> sources;
  private final MetricsPort metrics;
  private final BufferPool pool;
  private final LinkedBlockingQueue<HandoffItem> handoff = new LinkedBlockingQueue<>();
  private final Semaphore permits;
  private final CoalescingMailbox<SourceMeta> boundaries = new CoalescingMailbox<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile SourceMeta current = SourceMeta.NONE;
  private volatile Future<?> producer;

  // Consumer-thread state.
  private HandoffItem.Chunk pending;
  private int pendingPosition;
  private IOException failure;
  private boolean ended;
  private final byte[] single = new byte[1];

  private SourceMultiplexer(List<? extends Source> sources, MultiplexerSettings settings, MetricsPort metrics) {
    Objects.requireNonNull(sources, "sources");
    for (Source source : sources) {
      Objects.requireNonNull(source, "sources must not contain null");
    }
    this.sources = List.copyOf(sources);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(settings, "settings");
    this.pool = new BufferPool(settings.chunkSize(), settings.handoffDepth() + 2);
    this.permits = new Semaphore(settings.handoffDepth());
  }

  /**
   * Starts multiplexing with default settings and no metrics.
   *
   * @param sources ordered sources; may be empty
   * @return running multiplexer; the caller must close it
   */
  public static SourceMultiplexer start(List<? extends Source> sources) {
    return start(sources, MultiplexerSettings.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Starts multiplexing.
   *
   * @param sources ordered sources; may be empty
   * @param settings chunk and handoff tuning
   * @param metrics metrics sink
   * @return running multiplexer; the caller must close it
   */
  public static SourceMultiplexer start(
      List<? extends Source> sources, MultiplexerSettings settings, MetricsPort metrics) {
    SourceMultiplexer multiplexer = new SourceMultiplexer(sources, settings, metrics);
    ExecutorService executor = ExecutorFactories.newProducerExecutor(
        settings.threadPrefix(),
        (thread, ex) -> log.error("Multiplexer producer {} terminated unexpectedly", thread.getName(), ex));
    try {
      multiplexer.producer = executor.submit(multiplexer::produce);
    } finally {
      executor.shutdown();
    }
    log.debug("Multiplexer started over {} sources", multiplexer.sources.size());
    return multiplexer;
  }

  @Override
  public int read() throws IOException {
    int n = read(single, 0, 1);
    return n < 0 ? -1 : single[0] & 0xFF;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) throws IOException {
    Objects.checkFromIndexSize(offset, length, buffer.length);
    ensureOpen();
    if (length == 0) {
      return 0;
    }
    while (true) {
      if (pending != null) {
        return drainPending(buffer, offset, length);
      }
      if (failure != null) {
        throw failure;
      }
      if (ended) {
        return -1;
      }
      HandoffItem item = take();
      if (item instanceof HandoffItem.Boundary boundary) {
        permits.release();
        current = SourceMeta.boundary(boundary.name());
      } else if (item instanceof HandoffItem.Chunk chunk) {
        pending = chunk;
        pendingPosition = 0;
      } else if (item instanceof HandoffItem.Failure terminal) {
        failure = terminal.error();
      } else if (item == HandoffItem.End.INSTANCE) {
        ended = true;
      } else {
        throw closedException();
      }
    }
  }

  @Override
  public int available() throws IOException {
    ensureOpen();
    return pending == null ? 0 : pending.length() - pendingPosition;
  }

  @Override
  public SourceMeta current() {
    return current;
  }

  @Override
  public Optional<SourceMeta> awaitBoundary() throws InterruptedException {
    return boundaries.take();
  }

  @Override
  public Optional<SourceMeta> awaitBoundary(Duration timeout) throws InterruptedException, TimeoutException {
    return boundaries.take(timeout);
  }

  /**
   * Stops the producer without waiting for it, drops queued chunks, and wakes blocked readers and boundary
   * waiters. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    Future<?> task = producer;
    if (task != null) {
      task.cancel(true);
    }
    HandoffItem item;
    while ((item = handoff.poll()) != null) {
      item.discard();
    }
    handoff.add(HandoffItem.Closed.INSTANCE);
    boundaries.close();
    log.debug("Multiplexer closed at {}", current);
  }

  /**
   * Indicates whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed.get();
  }

  private int drainPending(byte[] buffer, int offset, int length) {
    int n = Math.min(length, pending.length() - pendingPosition);
    System.arraycopy(pending.data(), pendingPosition, buffer, offset, n);
    pendingPosition += n;
    current = current.advance(n);
    if (pendingPosition == pending.length()) {
      pending.discard();
      pending = null;
      permits.release();
    }
    return n;
  }

  private HandoffItem take() throws InterruptedIOException {
    try {
      return handoff.take();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("interrupted while waiting for merged bytes");
      interrupted.initCause(ex);
      throw interrupted;
    }
  }

  private void ensureOpen() throws IOException {
    if (closed.get()) {
      throw closedException();
    }
  }

  private static IOException closedException() {
    return new IOException("multiplexed stream closed");
  }

  private void produce() {
    int index = 0;
    try {
      for (; index < sources.size(); index++) {
        if (closed.get() || !stream(sources.get(index))) {
          return;
        }
      }
      handoff.add(HandoffItem.End.INSTANCE);
      log.info("Multiplexed {} sources to completion", sources.size());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Multiplexer producer interrupted at source {} of {}", index + 1, sources.size());
    } catch (RuntimeException ex) {
      log.error("Multiplexer producer failed at source {} of {}", index + 1, sources.size(), ex);
      handoff.add(new HandoffItem.Failure(new IOException("multiplexer producer failed", ex)));
    } finally {
      boundaries.close();
    }
  }

  /**
   * Streams one source to the consumer.
   *
   * @return {@code true} when the source ended cleanly and the next one may start
   */
  private boolean stream(Source source) throws InterruptedException {
    String name = source.name();
    InputStream in;
    try {
      in = Objects.requireNonNull(source.open(), "source returned a null stream");
    } catch (IOException | RuntimeException ex) {
      if (closed.get()) {
        return false;
      }
      metrics.increment("mux.source.failed");
      log.warn("Failed to open source {}", name, ex);
      handoff.add(new HandoffItem.Failure(new SourceOpenException(name, ex)));
      return false;
    }
    metrics.increment("mux.source.opened");
    log.debug("Opened source {}", name);

    long delivered = 0;
    try {
      boundaries.publish(SourceMeta.boundary(name));
      if (!enqueue(new HandoffItem.Boundary(name))) {
        return false;
      }
      while (true) {
        BufferPool.PooledBuffer buffer = pool.acquire();
        int n;
        try {
          n = in.read(buffer.borrowWritableArray(), 0, pool.bufferSize());
        } catch (IOException | RuntimeException ex) {
          buffer.close();
          if (closed.get()) {
            return false;
          }
          metrics.increment("mux.source.failed");
          log.warn("Read failed on source {} after {} bytes", name, delivered, ex);
          handoff.add(new HandoffItem.Failure(new SourceReadException(name, delivered, ex)));
          return false;
        }
        if (n < 0) {
          buffer.close();
          break;
        }
        if (n == 0) {
          buffer.close();
          continue;
        }
        if (!enqueue(new HandoffItem.Chunk(buffer, n))) {
          return false;
        }
        delivered += n;
      }
    } finally {
      closeSource(name, in);
    }
    metrics.increment("mux.source.completed");
    metrics.observe("mux.source.bytes", delivered);
    log.debug("Completed source {} ({} bytes)", name, delivered);
    return true;
  }

  private boolean enqueue(HandoffItem item) throws InterruptedException {
    long started = System.nanoTime();
    try {
      permits.acquire();
    } catch (InterruptedException ex) {
      item.discard();
      throw ex;
    }
    metrics.observe("mux.handoff.waitNanos", System.nanoTime() - started);
    if (closed.get()) {
      permits.release();
      item.discard();
      return false;
    }
    handoff.add(item);
    return true;
  }

  private void closeSource(String name, InputStream in) {
    try {
      in.close();
    } catch (IOException ex) {
      log.warn("Failed to close source {}", name, ex);
    }
  }
}
