package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.server.ListeningSocket;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies listening sockets that were created outside this process.
 *
 * @since 0.1.0
 */
public interface DescriptorSource {
  /**
   * Wraps a descriptor number inherited from the parent process.
   *
   * @param fd open descriptor number
   * @return socket handle owning {@code fd}
   * @throws IOException if {@code fd} is not an open descriptor
   */
  ListeningSocket inherit(int fd) throws IOException;

  /**
   * Opens {@code path}, duplicates its descriptor and closes the opened file.
   *
   * @param path file system path of a socket or descriptor link
   * @return socket handle owning the duplicate
   * @throws IOException if the path cannot be opened or duplicated
   */
  ListeningSocket recover(Path path) throws IOException;

  /**
   * Closes a descriptor previously returned by {@link #inherit(int)} or {@link #recover(Path)}.
   *
   * @param socket socket to release
   * @throws IOException if the descriptor cannot be closed
   */
  void close(ListeningSocket socket) throws IOException;
}
