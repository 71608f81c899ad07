package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.prism.application.component.ComponentCatalog;
import ca.gc.cra.prism.application.component.ComponentRegistry;
import ca.gc.cra.prism.application.component.ComponentResolutionException;
import ca.gc.cra.prism.application.component.ComponentRole;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.domain.http.HttpResponseMessage;
import ca.gc.cra.prism.infrastructure.app.ImagingServiceApp;
import ca.gc.cra.prism.testutil.RecordingMetrics;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void contextCarriesInputsUnchanged() {
    RecordingMetrics metrics = new RecordingMetrics();
    CompositionRoot root = new CompositionRoot(BuiltInComponents.catalog(), metrics);
    PrismConfig config = PrismConfig.of(Map.of("SECURITY_KEY", "k"));
    ServerParameters params = ServerParameters.builder().securityKey("k").build();

    ComponentRegistry registry = root.resolve(config);
    ExecutionContext context = root.context(params, config, registry);

    assertSame(params, context.server());
    assertSame(config, context.config());
    assertSame(registry, context.modules());
    assertSame(metrics, context.metrics());
    assertEquals(1, metrics.counter("startup.components.resolved"));
  }

  @Test
  void applicationDefaultsToImagingService() {
    CompositionRoot root = new CompositionRoot();
    PrismConfig config = PrismConfig.defaults();
    ExecutionContext context = root.context(ServerParameters.defaults(), config, root.resolve(config));

    assertInstanceOf(ImagingServiceApp.class, root.application(context));
  }

  @Test
  void applicationResolvedFromCatalogByName() {
    ComponentCatalog catalog = BuiltInComponents.catalog().toBuilder()
        .registerApplication("tests.app.teapot", ctx -> request -> HttpResponseMessage.text(418, "teapot"))
        .build();
    CompositionRoot root = new CompositionRoot(catalog);
    PrismConfig config = PrismConfig.defaults();
    ServerParameters params = ServerParameters.builder().appClass("tests.app.teapot").build();

    ImagingApplication app = root.application(root.context(params, config, root.resolve(config)));

    assertEquals(418, app.handle(HttpRequestMessage.get("/")).status());
  }

  @Test
  void unknownApplicationFails() {
    CompositionRoot root = new CompositionRoot();
    PrismConfig config = PrismConfig.defaults();
    ServerParameters params = ServerParameters.builder().appClass("tests.app.missing").build();
    ExecutionContext context = root.context(params, config, root.resolve(config));

    ComponentResolutionException ex =
        assertThrows(ComponentResolutionException.class, () -> root.application(context));
    assertEquals(ComponentRole.APPLICATION, ex.role());
  }

  @Test
  void applicationConstructorFailurePropagates() {
    ComponentCatalog catalog = ComponentCatalog.builder()
        .registerApplication("tests.app.broken", ctx -> {
          throw new IllegalStateException("boom");
        })
        .build();
    CompositionRoot root = new CompositionRoot(catalog);
    PrismConfig config = PrismConfig.defaults();
    ServerParameters params = ServerParameters.builder().appClass("tests.app.broken").build();
    ComponentRegistry registry = new CompositionRoot().resolve(config);

    assertThrows(IllegalStateException.class,
        () -> root.application(root.context(params, config, registry)));
  }
}
