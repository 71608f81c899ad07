package ca.gc.cra.prism.infrastructure.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.prism.application.component.ComponentCatalog;
import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.BuiltInComponents;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.domain.http.HttpResponseMessage;
import ca.gc.cra.prism.testutil.Contexts;
import ca.gc.cra.prism.testutil.RecordingMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ImagingServiceAppTest {

  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void healthcheckAnswersWorking() {
    ImagingServiceApp app = new ImagingServiceApp(Contexts.of(Map.of(), metrics));

    HttpResponseMessage response = app.handle(HttpRequestMessage.get("/healthcheck"));

    assertEquals(200, response.status());
    assertEquals("WORKING", response.bodyAsString());
    assertEquals(200, app.handle(HttpRequestMessage.get("/healthcheck/")).status());
  }

  @Test
  void healthcheckRouteIsConfigurable() {
    ImagingServiceApp app = new ImagingServiceApp(Contexts.of(Map.of("HEALTHCHECK_ROUTE", "/status"), metrics));

    assertEquals(200, app.handle(HttpRequestMessage.get("/status?check=1")).status());
    assertEquals(404, app.handle(HttpRequestMessage.get("/healthcheck")).status());
  }

  @Test
  void healthcheckRejectsOtherMethods() {
    ImagingServiceApp app = new ImagingServiceApp(Contexts.of(Map.of(), metrics));

    HttpResponseMessage response =
        app.handle(new HttpRequestMessage("POST", "/healthcheck", Map.of(), new byte[0]));

    assertEquals(405, response.status());
  }

  @Test
  void routingFailureReturns500AndReportsToErrorHandler() {
    List<Throwable> reported = new ArrayList<>();
    ComponentCatalog catalog = BuiltInComponents.catalog().toBuilder()
        .registerErrorHandler("tests.errors.collect",
            config -> (ErrorHandler) (context, request, cause) -> reported.add(cause))
        .build();
    PrismConfig config = PrismConfig.of(Map.of(
        "USE_CUSTOM_ERROR_HANDLING", true,
        "ERROR_HANDLER_MODULE", "tests.errors.collect"));
    CompositionRoot root = new CompositionRoot(catalog, metrics);
    ExecutionContext context = root.context(ServerParameters.defaults(), config, root.resolve(config));
    IllegalStateException failure = new IllegalStateException("boom");
    ImagingServiceApp app = new ImagingServiceApp(context) {
      @Override
      protected HttpResponseMessage route(HttpRequestMessage request) {
        throw failure;
      }
    };

    HttpResponseMessage response = app.handle(HttpRequestMessage.get("/anything"));

    assertEquals(500, response.status());
    assertEquals(1, reported.size());
    assertSame(failure, reported.get(0));
    assertEquals(1, metrics.counter("http.errors"));
  }
}
