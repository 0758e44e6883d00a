package ca.siteguard.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors the analysis orchestrator runs on.
 *
 * <p>Session and backend pools grow on demand and retire idle threads: a session thread blocks on its backend
 * tasks, so a bounded backend pool could starve sessions. Remote fan-out is capped separately by a semaphore
 * and local inference by the inference slot.</p>
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds an elastic executor for session or backend tasks.
   *
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newElasticPool(String prefix, UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        threadFactory(prefix, "siteguard-worker", true, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded executor for background model reloads.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured executor service
   */
  public static ExecutorService newReloadPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        1,
        1,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, "siteguard-reload", true, handler));
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
