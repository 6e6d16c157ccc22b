package ca.gc.cra.mergeflow.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that drive MERGEFLOW background producers.
 */
public final class ExecutorFactories {
  private static final AtomicInteger PRODUCER_INDEX = new AtomicInteger();

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor for one multiplexer producer.
   *
   * <p>The thread is a daemon so an abandoned, unclosed multiplexer never keeps the JVM alive.</p>
   *
   * @param prefix thread-name prefix; blank falls back to {@code mergeflow-mux}
   * @param handler uncaught exception handler installed on the producer thread; {@code null} ignores failures
   * @return configured executor service
   */
  public static ExecutorService newProducerExecutor(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "mergeflow-mux" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + PRODUCER_INDEX.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
