package ca.gc.cra.prism.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores original or transformed images keyed by request path.
 *
 * @since 0.1.0
 */
public interface ImageStorage {
  void put(String path, byte[] bytes) throws IOException;

  /**
   * Returns the stored bytes.
   *
   * @param path storage key
   * @return bytes, or empty when nothing is stored under {@code path}
   * @throws IOException if the storage cannot be read
   */
  Optional<byte[]> get(String path) throws IOException;

  boolean exists(String path) throws IOException;

  void remove(String path) throws IOException;
}
