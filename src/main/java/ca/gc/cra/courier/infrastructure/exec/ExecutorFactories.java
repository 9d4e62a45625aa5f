package ca.gc.cra.courier.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory helpers for the executors backing consume loops.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded executor that runs one reader's consume loop.
   *
   * <p>The worker is non-daemon so an active reader keeps the JVM alive until it is closed.</p>
   *
   * @param threadName name given to the worker thread
   * @param handler uncaught exception handler installed on the worker; {@code null} ignores failures
   * @return executor with exactly one worker thread
   */
  public static ExecutorService newConsumerWorker(String threadName, UncaughtExceptionHandler handler) {
    String name = (threadName == null || threadName.isBlank()) ? "courier-consume" : threadName;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(name);
          thread.setDaemon(false);
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
