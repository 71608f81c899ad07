package ca.gc.cra.prism.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread factory helpers aligned with PRISM naming conventions.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a factory producing threads named {@code prefix-0}, {@code prefix-1}, and so on.
   *
   * @param prefix thread-name prefix; defaults to {@code prism} when blank
   * @param daemon whether created threads are daemons
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return thread factory
   */
  public static ThreadFactory named(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "prism" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
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
