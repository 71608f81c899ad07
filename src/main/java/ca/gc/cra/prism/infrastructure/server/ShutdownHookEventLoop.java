package ca.gc.cra.prism.infrastructure.server;

import ca.gc.cra.prism.application.port.EventLoop;
import ca.gc.cra.prism.application.server.ShutdownSignal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production {@link EventLoop}: blocks until SIGINT or SIGTERM.
 *
 * <p>While running, SIGINT and SIGTERM are intercepted and only trigger the {@link ShutdownSignal}, so
 * the bootstrap thread performs the cleanup and the process exits with status 0. The previous
 * handlers are restored when the loop returns.</p>
 *
 * <p>A JVM shutdown hook stays registered as a fallback for terminations that bypass the handlers
 * ({@code System.exit} from elsewhere, or a platform without those signals). It triggers the signal and
 * holds the JVM open, bounded by the grace period, until the lifecycle marks cleanup finished.</p>
 */
public final class ShutdownHookEventLoop implements EventLoop {
  private static final Logger log = LoggerFactory.getLogger(ShutdownHookEventLoop.class);
  private static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);
  static final List<String> INTERRUPT_SIGNALS = List.of("INT", "TERM");

  private final Runtime runtime;
  private final Duration grace;
  private final SignalInstaller signals;

  public ShutdownHookEventLoop() {
    this(Runtime.getRuntime(), DEFAULT_GRACE, new JdkSignalInstaller());
  }

  ShutdownHookEventLoop(Runtime runtime, Duration grace, SignalInstaller signals) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.grace = Objects.requireNonNull(grace, "grace");
    this.signals = Objects.requireNonNull(signals, "signals");
  }

  @Override
  public void run(ShutdownSignal signal) {
    Thread hook = new Thread(() -> {
      signal.trigger();
      if (!signal.awaitStopped(grace)) {
        log.warn("Shutdown cleanup did not finish within {}", grace);
      }
    }, "prism-shutdown");
    runtime.addShutdownHook(hook);
    Map<String, Object> previous = installHandlers(signal);
    try {
      signal.awaitTriggered();
    } finally {
      restoreHandlers(previous);
      removeHook(hook);
    }
  }

  private Map<String, Object> installHandlers(ShutdownSignal signal) {
    Map<String, Object> previous = new LinkedHashMap<>();
    for (String name : INTERRUPT_SIGNALS) {
      try {
        previous.put(name, signals.install(name, () -> {
          log.debug("Received SIG{}", name);
          signal.trigger();
        }));
      } catch (IllegalArgumentException ex) {
        log.warn("Cannot intercept SIG{}; relying on the shutdown hook: {}", name, ex.getMessage());
      }
    }
    return previous;
  }

  private void restoreHandlers(Map<String, Object> previous) {
    previous.forEach((name, handler) -> {
      try {
        signals.restore(name, handler);
      } catch (IllegalArgumentException ex) {
        log.warn("Cannot restore handler for SIG{}: {}", name, ex.getMessage());
      }
    });
  }

  private void removeHook(Thread hook) {
    try {
      runtime.removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM is shutting down; keeping shutdown hook registered");
    }
  }

  /** Seam over the JVM signal API. */
  interface SignalInstaller {
    /**
     * Routes signal {@code name} to {@code action}.
     *
     * @return opaque previous handler, handed back to {@link #restore(String, Object)}
     * @throws IllegalArgumentException if the signal is unknown or reserved on this platform
     */
    Object install(String name, Runnable action);

    void restore(String name, Object previous);
  }

  static final class JdkSignalInstaller implements SignalInstaller {
    @Override
    public Object install(String name, Runnable action) {
      return sun.misc.Signal.handle(new sun.misc.Signal(name), received -> action.run());
    }

    @Override
    public void restore(String name, Object previous) {
      sun.misc.Signal.handle(new sun.misc.Signal(name), (sun.misc.SignalHandler) previous);
    }
  }
}
