package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.domain.http.HttpResponseMessage;

/**
 * Request handling entry point served by the HTTP server.
 *
 * @since 0.1.0
 */
public interface ImagingApplication {
  /**
   * Handles one request.
   *
   * @param request decoded request
   * @return response to write back
   */
  HttpResponseMessage handle(HttpRequestMessage request);
}
