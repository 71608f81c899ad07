package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.server.ShutdownSignal;

/**
 * Blocks the bootstrap thread while the server runs.
 *
 * @since 0.1.0
 */
public interface EventLoop {
  /**
   * Blocks until {@code signal} is triggered.
   *
   * @param signal interruption signal shared with the lifecycle manager
   */
  void run(ShutdownSignal signal);
}
