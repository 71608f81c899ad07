package ca.gc.cra.prism.application.server;

import java.util.Objects;

/**
 * Listening socket descriptor obtained from outside the server adapter.
 *
 * <p>The holder owns {@link #fd()}; the HTTP server closes it on stop.</p>
 *
 * @param fd open descriptor number
 * @param origin how the descriptor was obtained
 * @param source descriptor number or path as given on the command line, for diagnostics
 * @since 0.1.0
 */
public record ListeningSocket(int fd, Origin origin, String source) {

  /** How a descriptor was obtained. */
  public enum Origin {
    /** Inherited by number from the parent process. */
    INHERITED,
    /** Duplicated from a descriptor opened on a file system path. */
    PATH
  }

  public ListeningSocket {
    if (fd < 0) {
      throw new IllegalArgumentException("fd must not be negative (was " + fd + ")");
    }
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(source, "source");
  }
}
