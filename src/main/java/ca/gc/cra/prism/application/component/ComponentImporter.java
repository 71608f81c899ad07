package ca.gc.cra.prism.application.component;

import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.port.FeatureDetector;
import ca.gc.cra.prism.application.port.ImageFilter;
import ca.gc.cra.prism.application.port.ImageStorage;
import ca.gc.cra.prism.application.port.ImagingEngine;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.Settings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the components named in configuration into a {@link ComponentRegistry}.
 * <p><strong>Why:</strong> Every configured name is checked at startup so a typo stops the process before
 * it accepts traffic.</p>
 * <p><strong>Role:</strong> Bootstrap step between configuration loading and validation.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable catalog.</p>
 *
 * @since 0.1.0
 */
public final class ComponentImporter {
  private static final Logger log = LoggerFactory.getLogger(ComponentImporter.class);

  private final ComponentCatalog catalog;

  public ComponentImporter(ComponentCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * Resolves every role.
   *
   * <ul>
   *   <li>{@code ENGINE}, {@code LOADER}, {@code STORAGE}: required factories.</li>
   *   <li>{@code GIF_ENGINE}: only when {@code USE_GIFSICLE_ENGINE} is set.</li>
   *   <li>{@code RESULT_STORAGE}: only when non-blank.</li>
   *   <li>{@code DETECTORS}: one factory per name.</li>
   *   <li>{@code FILTERS}: every filter instantiated now.</li>
   *   <li>{@code ERROR_HANDLER_MODULE}: constructed with the configuration only when
   *   {@code USE_CUSTOM_ERROR_HANDLING} is set.</li>
   * </ul>
   *
   * @param config effective configuration
   * @return resolved components
   * @throws ComponentResolutionException if any configured name is unknown
   */
  public ComponentRegistry resolve(PrismConfig config) {
    Objects.requireNonNull(config, "config");

    ComponentFactory<ImagingEngine> engine =
        catalog.engine(ComponentRole.ENGINE, config.getString(Settings.ENGINE));

    Optional<ComponentFactory<ImagingEngine>> gifEngine = Optional.empty();
    if (config.getBoolean(Settings.USE_GIFSICLE_ENGINE)) {
      gifEngine = Optional.of(catalog.engine(ComponentRole.GIF_ENGINE, config.getString(Settings.GIF_ENGINE)));
    }

    List<ImageFilter> filters = new ArrayList<>();
    for (String name : config.getList(Settings.FILTERS)) {
      filters.add(catalog.filter(name));
    }

    Optional<ErrorHandler> errorHandler = Optional.empty();
    if (config.getBoolean(Settings.USE_CUSTOM_ERROR_HANDLING)) {
      errorHandler = Optional.of(catalog.errorHandler(config.getString(Settings.ERROR_HANDLER_MODULE), config));
    }

    Optional<ComponentFactory<ImageStorage>> resultStorage = Optional.empty();
    String resultStorageName = config.getString(Settings.RESULT_STORAGE).trim();
    if (!resultStorageName.isEmpty()) {
      resultStorage = Optional.of(catalog.storage(ComponentRole.RESULT_STORAGE, resultStorageName));
    }

    List<ComponentFactory<FeatureDetector>> detectors = new ArrayList<>();
    for (String name : config.getList(Settings.DETECTORS)) {
      detectors.add(catalog.detector(name));
    }

    ComponentRegistry registry = new ComponentRegistry(
        engine,
        gifEngine,
        filters,
        errorHandler,
        catalog.loader(config.getString(Settings.LOADER)),
        catalog.storage(ComponentRole.STORAGE, config.getString(Settings.STORAGE)),
        resultStorage,
        detectors);
    log.info("Resolved components: engine={}, gifEngine={}, filters={}, detectors={}, errorHandler={}",
        config.getString(Settings.ENGINE),
        gifEngine.isPresent() ? config.getString(Settings.GIF_ENGINE) : "<disabled>",
        filters.size(),
        detectors.size(),
        errorHandler.isPresent() ? config.getString(Settings.ERROR_HANDLER_MODULE) : "<disabled>");
    return registry;
  }
}
