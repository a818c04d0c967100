package ca.gc.cra.snare.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named threads that run decoy listeners and their connections.
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 60L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded cached pool for per-connection handler tasks.
   *
   * @param prefix thread-name prefix, e.g. {@code snare-ssh-conn}
   * @param handler uncaught exception handler installed on each worker thread; {@code null} ignores failures
   * @return executor whose idle threads expire after one minute
   */
  public static ExecutorService newConnectionPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedDaemonFactory(
        (prefix == null || prefix.isBlank()) ? "snare-conn" : prefix, handler);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory);
  }

  /**
   * Creates a single named thread, used for listener accept loops.
   *
   * @param name thread name
   * @param task loop body
   * @param handler uncaught exception handler; {@code null} ignores failures
   * @return unstarted daemon thread
   */
  public static Thread newAcceptThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"), Objects.requireNonNull(name, "name"));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }

  private static ThreadFactory namedDaemonFactory(String prefix, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
