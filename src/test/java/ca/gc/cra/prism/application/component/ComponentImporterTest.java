package ca.gc.cra.prism.application.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.port.ImageFilter;
import ca.gc.cra.prism.application.port.ImagingEngine;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.BuiltInComponents;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.infrastructure.engine.GifsicleEngineFactory;
import ca.gc.cra.prism.infrastructure.engine.PassthroughEngineFactory;
import ca.gc.cra.prism.infrastructure.loader.NoLoader;
import ca.gc.cra.prism.infrastructure.storage.NoStorage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComponentImporterTest {
  private static final NamedFilter FILL = new NamedFilter("fill");
  private static final NamedFilter QUALITY = new NamedFilter("quality");

  @Test
  void resolvesDefaults() {
    ComponentRegistry registry = importer().resolve(PrismConfig.defaults());

    assertInstanceOf(PassthroughEngineFactory.class, registry.engine());
    assertTrue(registry.gifEngine().isEmpty());
    assertTrue(registry.filters().isEmpty());
    assertInstanceOf(NoLoader.class, registry.loader().create(null));
    assertInstanceOf(NoStorage.class, registry.storage().create(null));
    assertTrue(registry.errorHandler().isEmpty());
    assertTrue(registry.resultStorage().isEmpty());
    assertTrue(registry.detectors().isEmpty());
  }

  @Test
  void gifEngineIsResolvedOnlyWhenEnabled() {
    ComponentRegistry registry = importer().resolve(PrismConfig.of(Map.of("USE_GIFSICLE_ENGINE", true)));

    assertInstanceOf(GifsicleEngineFactory.class, registry.gifEngine().orElseThrow());
  }

  @Test
  void gifEngineNameIsIgnoredWhenDisabled() {
    ComponentRegistry registry = importer().resolve(PrismConfig.of(Map.of("GIF_ENGINE", "not.registered")));

    assertFalse(registry.gifEngine().isPresent());
  }

  @Test
  void filtersResolveInConfiguredOrderAndByExpressionName() {
    ComponentRegistry registry = importer().resolve(PrismConfig.of(Map.of(
        "FILTERS", List.of("tests.filters.quality", "tests.filters.fill"))));

    assertEquals(List.of(QUALITY, FILL), registry.filters());
    assertSame(FILL, registry.filter("fill").orElseThrow());
    assertTrue(registry.filter("brightness").isEmpty());
  }

  @Test
  void customErrorHandlerIsConstructedWithConfiguration() {
    ComponentCatalog catalog = BuiltInComponents.catalog().toBuilder()
        .registerErrorHandler("tests.errors.recording", RecordingErrorHandler::new)
        .build();
    PrismConfig config = PrismConfig.of(Map.of(
        "USE_CUSTOM_ERROR_HANDLING", true,
        "ERROR_HANDLER_MODULE", "tests.errors.recording"));

    ComponentRegistry registry = new ComponentImporter(catalog).resolve(config);

    RecordingErrorHandler handler = (RecordingErrorHandler) registry.errorHandler().orElseThrow();
    assertSame(config, handler.config);
  }

  @Test
  void errorHandlerModuleIsIgnoredWhenCustomHandlingDisabled() {
    ComponentRegistry registry = importer().resolve(PrismConfig.of(Map.of(
        "ERROR_HANDLER_MODULE", "tests.errors.missing")));

    assertTrue(registry.errorHandler().isEmpty());
  }

  @Test
  void resultStorageAndDetectorsResolveWhenNamed() {
    ComponentRegistry registry = importer().resolve(PrismConfig.of(Map.of(
        "RESULT_STORAGE", "prism.storages.none",
        "DETECTORS", List.of("tests.detectors.none"))));

    assertTrue(registry.resultStorage().isPresent());
    assertEquals(1, registry.detectors().size());
  }

  @Test
  void unknownEngineFailsWithKnownNames() {
    ComponentResolutionException ex = assertThrows(ComponentResolutionException.class,
        () -> importer().resolve(PrismConfig.of(Map.of("ENGINE", "prism.engines.magick"))));

    assertEquals(ComponentRole.ENGINE, ex.role());
    assertEquals("prism.engines.magick", ex.componentName());
    assertTrue(ex.getMessage().contains("prism.engines.passthrough"));
  }

  @Test
  void unknownFilterFailsWholeResolution() {
    ComponentResolutionException ex = assertThrows(ComponentResolutionException.class,
        () -> importer().resolve(PrismConfig.of(Map.of(
            "FILTERS", List.of("tests.filters.fill", "prism.filters.sepia")))));

    assertEquals(ComponentRole.FILTER, ex.role());
    assertEquals("prism.filters.sepia", ex.componentName());
  }

  @Test
  void unknownCustomErrorHandlerFails() {
    ComponentResolutionException ex = assertThrows(ComponentResolutionException.class,
        () -> importer().resolve(PrismConfig.of(Map.of(
            "USE_CUSTOM_ERROR_HANDLING", "true",
            "ERROR_HANDLER_MODULE", "tests.errors.missing"))));

    assertEquals(ComponentRole.ERROR_HANDLER, ex.role());
  }

  private static ComponentImporter importer() {
    ComponentCatalog catalog = BuiltInComponents.catalog().toBuilder()
        .registerFilter("tests.filters.fill", () -> FILL)
        .registerFilter("tests.filters.quality", () -> QUALITY)
        .registerDetector("tests.detectors.none", () -> context -> engine -> List.of())
        .build();
    return new ComponentImporter(catalog);
  }

  private record NamedFilter(String filterName) implements ImageFilter {
    @Override
    public void apply(ImagingEngine engine, List<String> arguments) {}
  }

  private static final class RecordingErrorHandler implements ErrorHandler {
    private final PrismConfig config;

    RecordingErrorHandler(PrismConfig config) {
      this.config = config;
    }

    @Override
    public void handleError(ExecutionContext context, HttpRequestMessage request, Throwable cause) {}
  }
}
