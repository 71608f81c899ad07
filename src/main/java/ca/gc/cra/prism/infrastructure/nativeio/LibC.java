package ca.gc.cra.prism.infrastructure.nativeio;

import jnr.ffi.LibraryLoader;
import jnr.ffi.Platform;
import jnr.ffi.annotations.SaveError;

/**
 * JNR-FFI bindings for the libc descriptor calls used to adopt listening sockets.
 * <p>Methods map directly to the native functions; errors are reported through {@code errno}.</p>
 */
public interface LibC {
  /** Shared binding to the C library of the running platform. */
  LibC INSTANCE = LibraryLoader.create(LibC.class)
      .load(Platform.getNativePlatform().getStandardCLibraryName());

  int O_RDONLY = 0;
  int F_GETFD = 1;

  /**
   * Opens a path.
   *
   * @param path file system path
   * @param flags open flags such as {@link #O_RDONLY}
   * @return new descriptor, or {@code -1} with {@code errno} set
   */
  @SaveError
  int open(String path, int flags);

  /**
   * Duplicates a descriptor onto the lowest free number.
   *
   * @param fd open descriptor
   * @return duplicate, or {@code -1} with {@code errno} set
   */
  @SaveError
  int dup(int fd);

  @SaveError
  int close(int fd);

  /**
   * Issues a descriptor command without an argument, such as {@link #F_GETFD}.
   *
   * @return command result, or {@code -1} with {@code errno} set
   */
  @SaveError
  int fcntl(int fd, int cmd);

  String strerror(int errnum);
}
