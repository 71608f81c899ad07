package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.component.ComponentCatalog;
import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.ImageLoader;
import ca.gc.cra.prism.application.port.ImageStorage;
import ca.gc.cra.prism.infrastructure.app.ImagingServiceApp;
import ca.gc.cra.prism.infrastructure.engine.GifsicleEngineFactory;
import ca.gc.cra.prism.infrastructure.engine.PassthroughEngineFactory;
import ca.gc.cra.prism.infrastructure.errors.LoggingErrorHandler;
import ca.gc.cra.prism.infrastructure.loader.NoLoader;
import ca.gc.cra.prism.infrastructure.storage.NoStorage;

/**
 * Registrations of every component shipped with PRISM.
 *
 * <p>Only the minimum each role needs to resolve with default settings ships here; filters and
 * detectors are contributed by embedding code through {@link ComponentCatalog.Builder}.</p>
 *
 * @since 0.1.0
 */
public final class BuiltInComponents {

  private BuiltInComponents() {
    // Utility
  }

  /**
   * Returns a catalog holding the built-in engines, loader, storage, error handler and application.
   *
   * @return built-in catalog
   */
  public static ComponentCatalog catalog() {
    return register(ComponentCatalog.builder()).build();
  }

  /**
   * Adds the built-in registrations to {@code builder}.
   *
   * @param builder catalog builder
   * @return the same builder
   */
  public static ComponentCatalog.Builder register(ComponentCatalog.Builder builder) {
    return builder
        .registerEngine(PassthroughEngineFactory.NAME, PassthroughEngineFactory::new)
        .registerEngine(GifsicleEngineFactory.NAME, GifsicleEngineFactory::new)
        .registerLoader(NoLoader.NAME, BuiltInComponents::noLoader)
        .registerStorage(NoStorage.NAME, BuiltInComponents::noStorage)
        .registerErrorHandler(LoggingErrorHandler.NAME, LoggingErrorHandler::new)
        .registerApplication(ImagingServiceApp.NAME, ImagingServiceApp::new);
  }

  private static ComponentFactory<ImageLoader> noLoader() {
    return context -> new NoLoader();
  }

  private static ComponentFactory<ImageStorage> noStorage() {
    return context -> new NoStorage();
  }
}
