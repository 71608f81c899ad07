package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.server.ListeningSocket;
import java.io.IOException;

/**
 * <strong>What:</strong> HTTP server seam driven by the lifecycle manager.
 * <p><strong>Why:</strong> Keeps socket acquisition order and shutdown sequencing testable without a real
 * network stack.</p>
 * <p><strong>Thread-safety:</strong> Driven from the bootstrap thread only; {@link #stop()} may be called
 * from a shutdown hook thread.</p>
 *
 * @since 0.1.0
 */
public interface HttpServerPort {
  /**
   * Binds and listens on a TCP address.
   *
   * @param port TCP port; {@code 0} picks an ephemeral port
   * @param address bind address
   * @throws IOException if the address cannot be bound
   */
  void bind(int port, String address) throws IOException;

  /**
   * Adopts an already-listening socket.
   *
   * @param socket descriptor obtained from a {@code DescriptorSource}
   * @throws IOException if the descriptor cannot be used as a listening socket
   */
  void addSocket(ListeningSocket socket) throws IOException;

  /**
   * Starts accepting connections.
   *
   * @param workers number of worker threads serving connections; at least one
   */
  void start(int workers);

  /**
   * Stops accepting, closes every listening socket and releases threads. Idempotent.
   */
  void stop();
}
