package ca.gc.cra.prism.application.startup;

import ca.gc.cra.prism.application.component.ComponentRegistry;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.ServerParameters;
import java.util.Objects;

/**
 * Read-only context shared by the application and every request handler.
 *
 * @param server validated server parameters
 * @param config effective configuration
 * @param modules resolved components
 * @param metrics metrics sink
 * @since 0.1.0
 */
public record ExecutionContext(
    ServerParameters server, PrismConfig config, ComponentRegistry modules, MetricsPort metrics) {

  public ExecutionContext {
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(modules, "modules");
    Objects.requireNonNull(metrics, "metrics");
  }
}
