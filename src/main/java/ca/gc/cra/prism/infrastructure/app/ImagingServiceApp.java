package ca.gc.cra.prism.infrastructure.app;

import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.Settings;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.domain.http.HttpResponseMessage;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Default PRISM application, registered as {@code prism.app.imaging}.
 * <p><strong>Role:</strong> Routes requests received by the HTTP server. Answers the health check and
 * returns {@code 404} for every other path.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable context; called concurrently.</p>
 */
public class ImagingServiceApp implements ImagingApplication {
  private static final Logger log = LoggerFactory.getLogger(ImagingServiceApp.class);

  public static final String NAME = "prism.app.imaging";
  static final String HEALTHY_BODY = "WORKING";

  private final ExecutionContext context;
  private final String healthcheckRoute;

  public ImagingServiceApp(ExecutionContext context) {
    this.context = Objects.requireNonNull(context, "context");
    String route = context.config().getString(Settings.HEALTHCHECK_ROUTE).trim();
    this.healthcheckRoute = route.isEmpty() ? "/healthcheck" : route;
  }

  @Override
  public final HttpResponseMessage handle(HttpRequestMessage request) {
    try {
      return route(request);
    } catch (RuntimeException ex) {
      log.error("Unhandled failure for {} {}", request.method(), request.path(), ex);
      context.metrics().increment("http.errors");
      context.modules().errorHandler().ifPresent(handler -> report(handler, request, ex));
      return HttpResponseMessage.text(500, "Internal Server Error");
    }
  }

  /**
   * Routes one request. Subclasses may add routes and fall back to this implementation.
   *
   * @param request decoded request
   * @return response
   */
  protected HttpResponseMessage route(HttpRequestMessage request) {
    if (healthcheckRoute.equals(request.path()) || (healthcheckRoute + "/").equals(request.path())) {
      if (!"GET".equals(request.method()) && !"HEAD".equals(request.method())) {
        return HttpResponseMessage.text(405, "Method Not Allowed");
      }
      return HttpResponseMessage.text(200, HEALTHY_BODY);
    }
    return HttpResponseMessage.text(404, "Not Found");
  }

  protected ExecutionContext context() {
    return context;
  }

  private void report(
      ErrorHandler handler, HttpRequestMessage request, RuntimeException ex) {
    try {
      handler.handleError(context, request, ex);
    } catch (RuntimeException handlerFailure) {
      log.warn("Error handler {} failed", handler.getClass().getName(), handlerFailure);
    }
  }
}
