package ca.gc.cra.prism.application.port;

import java.io.IOException;

/**
 * Fetches source images by URL or relative path.
 *
 * @since 0.1.0
 */
public interface ImageLoader {
  /**
   * Loads the image.
   *
   * @param url absolute URL or loader-relative path
   * @return encoded image bytes
   * @throws IOException if the image cannot be fetched
   */
  byte[] load(String url) throws IOException;
}
