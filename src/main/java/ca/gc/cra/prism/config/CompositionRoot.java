package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.component.ComponentCatalog;
import ca.gc.cra.prism.application.component.ComponentImporter;
import ca.gc.cra.prism.application.component.ComponentRegistry;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns validated startup inputs into the execution context
 * and the application.
 * <p><strong>Why:</strong> Keeps catalog and metrics wiring in one place so the CLI and tests share it.</p>
 * <p><strong>Role:</strong> Bootstrap layer between validation and the server lifecycle.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable collaborators; methods are invoked once at startup.</p>
 *
 * @since 0.1.0
 * @see BuiltInComponents
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ComponentCatalog catalog;
  private final MetricsPort metrics;

  /** Creates a root over the built-in catalog without metrics. */
  public CompositionRoot() {
    this(BuiltInComponents.catalog(), MetricsPort.NO_OP);
  }

  public CompositionRoot(ComponentCatalog catalog) {
    this(catalog, MetricsPort.NO_OP);
  }

  public CompositionRoot(ComponentCatalog catalog, MetricsPort metrics) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Resolves every configured component against the catalog.
   *
   * @param config effective configuration
   * @return resolved components
   */
  public ComponentRegistry resolve(PrismConfig config) {
    ComponentRegistry registry = new ComponentImporter(catalog).resolve(config);
    metrics.increment("startup.components.resolved");
    return registry;
  }

  /**
   * Builds the execution context. Pure construction; nothing is started.
   *
   * @param server validated server parameters
   * @param config effective configuration
   * @param registry resolved components
   * @return execution context
   */
  public ExecutionContext context(ServerParameters server, PrismConfig config, ComponentRegistry registry) {
    return new ExecutionContext(server, config, registry, metrics);
  }

  /**
   * Constructs the application named by {@code context.server().appClass()}.
   *
   * @param context execution context passed to the application
   * @return application instance
   * @throws ca.gc.cra.prism.application.component.ComponentResolutionException if the name is unknown
   */
  public ImagingApplication application(ExecutionContext context) {
    String name = context.server().appClass();
    ImagingApplication application = catalog.application(name, context);
    log.debug("Built application {} ({})", name, application.getClass().getName());
    return application;
  }

  public ComponentCatalog catalog() {
    return catalog;
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
