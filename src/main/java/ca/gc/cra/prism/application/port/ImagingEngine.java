package ca.gc.cra.prism.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Contract implemented by imaging engines.
 * <p><strong>Role:</strong> Per-request component created by a {@link ComponentFactory}; filters and
 * detectors operate on it. Pixel operations belong to concrete engines and are not part of the
 * bootstrap contract.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance serves one request.</p>
 *
 * @since 0.1.0
 */
public interface ImagingEngine {
  /**
   * Accepts the source image.
   *
   * @param buffer encoded image bytes
   * @param extension source extension such as {@code .png}, used as a format hint
   * @throws IOException if the bytes cannot be accepted
   */
  void load(byte[] buffer, String extension) throws IOException;

  /**
   * Encodes the current image.
   *
   * @return encoded bytes
   * @throws IOException if encoding fails
   * @throws IllegalStateException if no image is loaded
   */
  byte[] read() throws IOException;
}
