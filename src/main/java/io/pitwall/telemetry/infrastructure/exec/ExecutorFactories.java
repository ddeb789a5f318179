package io.pitwall.telemetry.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named daemon threads used by sources and transports.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for fixed-interval ticks.
   *
   * @param prefix thread-name prefix
   * @return scheduler whose cancelled tasks are removed immediately
   */
  public static ScheduledExecutorService newTickScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, daemonFactory(prefix, "pitwall-tick"));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds a bounded pool for background history fetches. Submissions beyond the queue capacity are
   * rejected so a slow store cannot accumulate unbounded work.
   *
   * @param size number of worker threads
   * @param queueCapacity pending fetches allowed
   * @param prefix thread-name prefix
   * @return executor service
   */
  public static ExecutorService newFetchPool(int size, int queueCapacity, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        30L,
        TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        daemonFactory(prefix, "pitwall-fetch"),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a thread factory producing named daemon threads.
   *
   * @param prefix thread-name prefix; {@code fallback} when blank
   * @param fallback prefix used when {@code prefix} is blank
   * @return thread factory
   */
  public static ThreadFactory daemonFactory(String prefix, String fallback) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }
}
