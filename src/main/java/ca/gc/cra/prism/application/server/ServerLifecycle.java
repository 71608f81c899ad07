package ca.gc.cra.prism.application.server;

import ca.gc.cra.prism.application.component.ComponentRegistry;
import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.DescriptorSource;
import ca.gc.cra.prism.application.port.EventLoop;
import ca.gc.cra.prism.application.port.HttpServerPort;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.ConfigValues;
import ca.gc.cra.prism.config.ServerParameters;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives the server through {@code CREATED -> BOUND -> RUNNING -> STOPPED}.
 * <p><strong>Why:</strong> Owns socket acquisition, the blocking run and the interruption cleanup so the
 * engine factory is always released exactly once.</p>
 * <p><strong>Role:</strong> Application service invoked by the CLI after validation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Acquire the listening socket from an address, an inherited descriptor or a descriptor path.</li>
 *   <li>Start the server with a single worker and block in the {@link EventLoop}.</li>
 *   <li>On interruption print the closing notice, stop the server and clean up engine factories.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Driven by the bootstrap thread; {@link #state()} may be read from any
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class ServerLifecycle {
  private static final Logger log = LoggerFactory.getLogger(ServerLifecycle.class);

  /** Line printed to stdout when the server stops after an interruption. */
  public static final String CLOSED_NOTICE = "-- prism closed by user interruption --";

  private final ExecutionContext context;
  private final HttpServerPort server;
  private final DescriptorSource descriptors;
  private final EventLoop eventLoop;
  private final Consumer<String> notices;
  private final ShutdownSignal signal;
  private final AtomicBoolean cleaned = new AtomicBoolean();
  private volatile LifecycleState state = LifecycleState.CREATED;

  public ServerLifecycle(
      ExecutionContext context,
      HttpServerPort server,
      DescriptorSource descriptors,
      EventLoop eventLoop,
      Consumer<String> notices) {
    this(context, server, descriptors, eventLoop, notices, new ShutdownSignal());
  }

  public ServerLifecycle(
      ExecutionContext context,
      HttpServerPort server,
      DescriptorSource descriptors,
      EventLoop eventLoop,
      Consumer<String> notices,
      ShutdownSignal signal) {
    this.context = Objects.requireNonNull(context, "context");
    this.server = Objects.requireNonNull(server, "server");
    this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
    this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    this.notices = Objects.requireNonNull(notices, "notices");
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  /**
   * Acquires the listening socket according to {@code ServerParameters.fd}.
   *
   * <ul>
   *   <li>absent: bind {@code ip:port};</li>
   *   <li>decimal integer: adopt the inherited descriptor; numbers outside {@code 0..Integer.MAX_VALUE}
   *   are rejected;</li>
   *   <li>anything else: treat as a path, duplicate its descriptor and adopt the duplicate.</li>
   * </ul>
   *
   * @throws IOException if the socket cannot be acquired or adopted; a descriptor that the server
   *     refuses is closed again and the state stays {@link LifecycleState#CREATED}
   * @throws IllegalStateException if called more than once
   */
  public void bind() throws IOException {
    requireState(LifecycleState.CREATED);
    ServerParameters params = context.server();
    Optional<String> hint = params.fdHint();
    if (hint.isEmpty()) {
      log.debug("Binding {}:{}", params.ip(), params.port());
      server.bind(params.port(), params.ip());
    } else {
      String fd = hint.get();
      Optional<Long> number = ConfigValues.coerceInteger(fd);
      ListeningSocket socket = number.isPresent()
          ? descriptors.inherit(descriptorNumber(number.get()))
          : descriptors.recover(Path.of(fd));
      log.debug("Adopting {} descriptor {} from {}", socket.origin(), socket.fd(), socket.source());
      adopt(socket);
    }
    state = LifecycleState.BOUND;
    context.metrics().increment("startup.bound");
  }

  private void adopt(ListeningSocket socket) throws IOException {
    try {
      server.addSocket(socket);
    } catch (IOException | RuntimeException ex) {
      try {
        descriptors.close(socket);
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw ex;
    }
  }

  private static int descriptorNumber(long fd) throws IOException {
    if (fd < 0 || fd > Integer.MAX_VALUE) {
      throw new IOException("Descriptor " + fd + " is outside the range 0.." + Integer.MAX_VALUE);
    }
    return (int) fd;
  }

  /**
   * Starts the server and blocks until interruption, then cleans up.
   *
   * @throws IllegalStateException if {@link #bind()} has not succeeded
   */
  public void run() {
    requireState(LifecycleState.BOUND);
    try {
      server.start(1);
      state = LifecycleState.RUNNING;
      log.info("PRISM running with {}", context.server());
      eventLoop.run(signal);
      notices.accept(CLOSED_NOTICE);
      context.metrics().increment("shutdown.interrupted");
    } finally {
      shutdown();
    }
  }

  /**
   * Returns the interruption signal observed by the event loop.
   *
   * @return shared signal
   */
  public ShutdownSignal signal() {
    return signal;
  }

  public LifecycleState state() {
    return state;
  }

  private void shutdown() {
    try {
      server.stop();
    } catch (RuntimeException ex) {
      log.warn("Failed to stop HTTP server cleanly", ex);
    } finally {
      try {
        cleanupEngines();
      } finally {
        state = LifecycleState.STOPPED;
        signal.markStopped();
      }
    }
  }

  private void cleanupEngines() {
    if (!cleaned.compareAndSet(false, true)) {
      return;
    }
    ComponentRegistry registry = context.modules();
    cleanup("engine", registry.engine());
    registry.gifEngine().ifPresent(factory -> cleanup("gif engine", factory));
  }

  private static void cleanup(String role, ComponentFactory<?> factory) {
    try {
      factory.cleanup();
    } catch (RuntimeException ex) {
      log.warn("Cleanup of {} factory {} failed", role, factory.getClass().getName(), ex);
    }
  }

  private void requireState(LifecycleState expected) {
    if (state != expected) {
      throw new IllegalStateException("Lifecycle must be " + expected + " but is " + state);
    }
  }
}
