package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;

/**
 * Receives request failures when custom error handling is enabled.
 *
 * <p>One instance is constructed with the configuration at startup and shared by all requests.</p>
 *
 * @since 0.1.0
 */
public interface ErrorHandler {
  /**
   * Reports a failure.
   *
   * @param context execution context
   * @param request request that failed
   * @param cause failure raised while handling the request
   */
  void handleError(ExecutionContext context, HttpRequestMessage request, Throwable cause);
}
