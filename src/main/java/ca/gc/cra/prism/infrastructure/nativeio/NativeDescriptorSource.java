package ca.gc.cra.prism.infrastructure.nativeio;

import ca.gc.cra.prism.application.port.DescriptorSource;
import ca.gc.cra.prism.application.server.ListeningSocket;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Descriptor source backed by libc through jnr-ffi.
 *
 * <p>{@link #recover(Path)} always closes the descriptor it opened, whether duplication succeeds or
 * not; the returned socket owns only the duplicate.</p>
 */
public final class NativeDescriptorSource implements DescriptorSource {
  private static final Logger log = LoggerFactory.getLogger(NativeDescriptorSource.class);

  private final LibC libc;

  public NativeDescriptorSource() {
    this(LibC.INSTANCE);
  }

  NativeDescriptorSource(LibC libc) {
    this.libc = Objects.requireNonNull(libc, "libc");
  }

  @Override
  public ListeningSocket inherit(int fd) throws IOException {
    if (fd < 0) {
      throw new IOException("Descriptor must not be negative (was " + fd + ")");
    }
    if (libc.fcntl(fd, LibC.F_GETFD) == -1) {
      throw new IOException("Descriptor " + fd + " is not open: " + lastError());
    }
    return new ListeningSocket(fd, ListeningSocket.Origin.INHERITED, Integer.toString(fd));
  }

  @Override
  public ListeningSocket recover(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    int opened = libc.open(path.toString(), LibC.O_RDONLY);
    if (opened == -1) {
      throw new IOException("Unable to open descriptor path " + path + ": " + lastError());
    }
    try {
      int duplicate = libc.dup(opened);
      if (duplicate == -1) {
        throw new IOException("Unable to duplicate descriptor of " + path + ": " + lastError());
      }
      log.debug("Duplicated descriptor {} of {} as {}", opened, path, duplicate);
      return new ListeningSocket(duplicate, ListeningSocket.Origin.PATH, path.toString());
    } finally {
      if (libc.close(opened) == -1) {
        log.warn("Unable to close descriptor {} opened from {}: {}", opened, path, lastError());
      }
    }
  }

  @Override
  public void close(ListeningSocket socket) throws IOException {
    if (libc.close(socket.fd()) == -1) {
      throw new IOException("Unable to close descriptor " + socket.fd() + ": " + lastError());
    }
  }

  /**
   * Reports whether a descriptor is open.
   *
   * @param fd descriptor number
   * @return {@code true} if {@code fcntl(F_GETFD)} succeeds
   */
  boolean isOpen(int fd) {
    return fd >= 0 && libc.fcntl(fd, LibC.F_GETFD) != -1;
  }

  private String lastError() {
    int errno = jnr.ffi.Runtime.getRuntime(libc).getLastError();
    return libc.strerror(errno) + " (errno " + errno + ")";
  }
}
