package ca.gc.cra.rdt.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the threads a transport endpoint needs: one timer scheduler shared by every
 * timer, and one reader thread per endpoint.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final AtomicInteger READER_INDEX = new AtomicInteger();

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded scheduler that drives retransmission, persist and grace timers.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return scheduler whose cancelled tasks are removed from the queue eagerly
   */
  public static ScheduledExecutorService newTimerScheduler(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "rdt-timer" : prefix;
    ThreadFactory factory = namedDaemonFactory(threadPrefix, handler);
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Creates (but does not start) a reader thread.
   *
   * @param prefix thread-name prefix
   * @param body reader loop
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return unstarted daemon thread
   */
  public static Thread newReaderThread(String prefix, Runnable body, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "rdt-reader" : prefix;
    Thread thread = new Thread(Objects.requireNonNull(body, "body"));
    thread.setName(threadPrefix + "-" + READER_INDEX.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(effective(handler));
    return thread;
  }

  private static ThreadFactory namedDaemonFactory(String threadPrefix, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = effective(handler);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static UncaughtExceptionHandler effective(UncaughtExceptionHandler handler) {
    return Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Uncaught failure on thread {}", t.getName(), ex));
  }
}
