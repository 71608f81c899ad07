package ca.gc.cra.prism.application.component;

import ca.gc.cra.prism.application.port.ComponentFactory;
import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.port.FeatureDetector;
import ca.gc.cra.prism.application.port.ImageFilter;
import ca.gc.cra.prism.application.port.ImageLoader;
import ca.gc.cra.prism.application.port.ImageStorage;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.port.ImagingEngine;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.PrismConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Name-to-factory lookup table for every pluggable role.
 * <p><strong>Why:</strong> Components named in configuration are resolved against explicit registrations
 * instead of being loaded reflectively, so unknown names fail fast with the list of valid ones.</p>
 * <p><strong>Role:</strong> Immutable registry consulted by {@link ComponentImporter} and the composition
 * root.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}.</p>
 *
 * @since 0.1.0
 */
public final class ComponentCatalog {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_]+(?:\\.[A-Za-z0-9_]+)*$");

  private final Map<String, Supplier<? extends ComponentFactory<ImagingEngine>>> engines;
  private final Map<String, Supplier<? extends ImageFilter>> filters;
  private final Map<String, Function<PrismConfig, ? extends ErrorHandler>> errorHandlers;
  private final Map<String, Supplier<? extends ComponentFactory<ImageLoader>>> loaders;
  private final Map<String, Supplier<? extends ComponentFactory<ImageStorage>>> storages;
  private final Map<String, Supplier<? extends ComponentFactory<FeatureDetector>>> detectors;
  private final Map<String, Function<ExecutionContext, ? extends ImagingApplication>> applications;

  private ComponentCatalog(Builder builder) {
    this.engines = Collections.unmodifiableMap(new LinkedHashMap<>(builder.engines));
    this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
    this.errorHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errorHandlers));
    this.loaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.loaders));
    this.storages = Collections.unmodifiableMap(new LinkedHashMap<>(builder.storages));
    this.detectors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.detectors));
    this.applications = Collections.unmodifiableMap(new LinkedHashMap<>(builder.applications));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this catalog's registrations.
   *
   * @return builder for extending the catalog
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.engines.putAll(engines);
    builder.filters.putAll(filters);
    builder.errorHandlers.putAll(errorHandlers);
    builder.loaders.putAll(loaders);
    builder.storages.putAll(storages);
    builder.detectors.putAll(detectors);
    builder.applications.putAll(applications);
    return builder;
  }

  /**
   * Creates a new engine factory. Both {@link ComponentRole#ENGINE} and {@link ComponentRole#GIF_ENGINE}
   * resolve against the engine table.
   *
   * @param role role being resolved, used in diagnostics
   * @param name registered name
   * @return new factory instance
   * @throws ComponentResolutionException if {@code name} is not registered
   */
  public ComponentFactory<ImagingEngine> engine(ComponentRole role, String name) {
    return lookup(engines, role, name).get();
  }

  public ImageFilter filter(String name) {
    return lookup(filters, ComponentRole.FILTER, name).get();
  }

  public ErrorHandler errorHandler(String name, PrismConfig config) {
    return lookup(errorHandlers, ComponentRole.ERROR_HANDLER, name).apply(config);
  }

  public ComponentFactory<ImageLoader> loader(String name) {
    return lookup(loaders, ComponentRole.LOADER, name).get();
  }

  /**
   * Creates a new storage factory for {@link ComponentRole#STORAGE} or {@link ComponentRole#RESULT_STORAGE}.
   */
  public ComponentFactory<ImageStorage> storage(ComponentRole role, String name) {
    return lookup(storages, role, name).get();
  }

  public ComponentFactory<FeatureDetector> detector(String name) {
    return lookup(detectors, ComponentRole.DETECTOR, name).get();
  }

  /**
   * Constructs the application registered under {@code name}.
   *
   * @param name registered application name
   * @param context execution context passed to the application constructor
   * @return new application
   * @throws ComponentResolutionException if {@code name} is not registered
   */
  public ImagingApplication application(String name, ExecutionContext context) {
    return lookup(applications, ComponentRole.APPLICATION, name).apply(context);
  }

  /**
   * Returns the registered names for a role.
   *
   * @param role component role
   * @return names in registration order
   */
  public Set<String> names(ComponentRole role) {
    return switch (role) {
      case ENGINE, GIF_ENGINE -> engines.keySet();
      case FILTER -> filters.keySet();
      case ERROR_HANDLER -> errorHandlers.keySet();
      case LOADER -> loaders.keySet();
      case STORAGE, RESULT_STORAGE -> storages.keySet();
      case DETECTOR -> detectors.keySet();
      case APPLICATION -> applications.keySet();
    };
  }

  private static <T> T lookup(Map<String, T> table, ComponentRole role, String name) {
    String key = name == null ? "" : name.trim();
    T entry = table.get(key);
    if (entry == null) {
      throw new ComponentResolutionException(role, key, table.keySet());
    }
    return entry;
  }

  /** Collects registrations; a later registration under the same name replaces the earlier one. */
  public static final class Builder {
    private final Map<String, Supplier<? extends ComponentFactory<ImagingEngine>>> engines = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends ImageFilter>> filters = new LinkedHashMap<>();
    private final Map<String, Function<PrismConfig, ? extends ErrorHandler>> errorHandlers = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends ComponentFactory<ImageLoader>>> loaders = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends ComponentFactory<ImageStorage>>> storages = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends ComponentFactory<FeatureDetector>>> detectors =
        new LinkedHashMap<>();
    private final Map<String, Function<ExecutionContext, ? extends ImagingApplication>> applications =
        new LinkedHashMap<>();

    private Builder() {}

    public Builder registerEngine(String name, Supplier<? extends ComponentFactory<ImagingEngine>> factory) {
      engines.put(validName(name), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public Builder registerFilter(String name, Supplier<? extends ImageFilter> filter) {
      filters.put(validName(name), Objects.requireNonNull(filter, "filter"));
      return this;
    }

    public Builder registerErrorHandler(String name, Function<PrismConfig, ? extends ErrorHandler> handler) {
      errorHandlers.put(validName(name), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder registerLoader(String name, Supplier<? extends ComponentFactory<ImageLoader>> factory) {
      loaders.put(validName(name), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public Builder registerStorage(String name, Supplier<? extends ComponentFactory<ImageStorage>> factory) {
      storages.put(validName(name), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public Builder registerDetector(
        String name, Supplier<? extends ComponentFactory<FeatureDetector>> factory) {
      detectors.put(validName(name), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public Builder registerApplication(
        String name, Function<ExecutionContext, ? extends ImagingApplication> application) {
      applications.put(validName(name), Objects.requireNonNull(application, "application"));
      return this;
    }

    public ComponentCatalog build() {
      return new ComponentCatalog(this);
    }

    private static String validName(String name) {
      if (name == null || !NAME_PATTERN.matcher(name).matches()) {
        throw new IllegalArgumentException("component name must be dotted identifiers (was " + name + ")");
      }
      return name;
    }
  }
}
