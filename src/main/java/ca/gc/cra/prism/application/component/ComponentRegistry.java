package ca.gc.cra.prism.application.component;

import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.port.FeatureDetector;
import ca.gc.cra.prism.application.port.ImageFilter;
import ca.gc.cra.prism.application.port.ImageLoader;
import ca.gc.cra.prism.application.port.ImageStorage;
import ca.gc.cra.prism.application.port.ImagingEngine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Components resolved once per process.
 *
 * <p>Engines, loader, storages and detectors are factory references instantiated per request; filters and
 * the error handler are live shared instances.</p>
 *
 * @param engine imaging engine factory
 * @param gifEngine animated-image engine factory, present only when gifsicle processing is enabled
 * @param filters loaded filters in configuration order
 * @param errorHandler error handler, present only when custom error handling is enabled
 * @param loader loader factory
 * @param storage storage factory
 * @param resultStorage result storage factory, absent when {@code RESULT_STORAGE} is blank
 * @param detectors detector factories in configuration order
 * @since 0.1.0
 */
public record ComponentRegistry(
    ComponentFactory<ImagingEngine> engine,
    Optional<ComponentFactory<ImagingEngine>> gifEngine,
    List<ImageFilter> filters,
    Optional<ErrorHandler> errorHandler,
    ComponentFactory<ImageLoader> loader,
    ComponentFactory<ImageStorage> storage,
    Optional<ComponentFactory<ImageStorage>> resultStorage,
    List<ComponentFactory<FeatureDetector>> detectors) {

  public ComponentRegistry {
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(gifEngine, "gifEngine");
    filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    Objects.requireNonNull(errorHandler, "errorHandler");
    Objects.requireNonNull(loader, "loader");
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(resultStorage, "resultStorage");
    detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors"));
  }

  /**
   * Finds a loaded filter by its expression name.
   *
   * @param name filter name such as {@code brightness}
   * @return matching filter, or empty
   */
  public Optional<ImageFilter> filter(String name) {
    return filters.stream().filter(f -> f.filterName().equals(name)).findFirst();
  }
}
