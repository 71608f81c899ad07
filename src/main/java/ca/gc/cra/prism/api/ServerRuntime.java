package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.component.ComponentCatalog;
import ca.gc.cra.prism.application.component.ComponentRegistry;
import ca.gc.cra.prism.application.port.BinaryLocator;
import ca.gc.cra.prism.application.port.DescriptorSource;
import ca.gc.cra.prism.application.port.EventLoop;
import ca.gc.cra.prism.application.port.HttpServerPort;
import ca.gc.cra.prism.application.port.ImagingApplication;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.server.ListeningSocket;
import ca.gc.cra.prism.application.server.ServerLifecycle;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.application.startup.StartupValidator;
import ca.gc.cra.prism.config.BuiltInComponents;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.ConfigLoader;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.nativeio.NativeDescriptorSource;
import ca.gc.cra.prism.infrastructure.server.NettyHttpServer;
import ca.gc.cra.prism.infrastructure.server.PathBinaryLocator;
import ca.gc.cra.prism.infrastructure.server.ShutdownHookEventLoop;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import ca.gc.cra.prism.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Collaborators used by {@link Main} to bootstrap and run the server.
 * <p><strong>Why:</strong> Production wiring lives in {@link #system()}; tests substitute fakes for the
 * socket, descriptor, binary lookup and event loop seams.</p>
 * <p><strong>Role:</strong> Outermost adapter; owns the metrics sink for the lifetime of the process.</p>
 * <p><strong>Thread-safety:</strong> Used from the bootstrap thread only.</p>
 *
 * @since 0.1.0
 */
public final class ServerRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ServerRuntime.class);

  private final ComponentCatalog catalog;
  private final MetricsPort metrics;
  private final BinaryLocator binaries;
  private final Supplier<DescriptorSource> descriptors;
  private final BiFunction<ImagingApplication, MetricsPort, HttpServerPort> servers;
  private final EventLoop eventLoop;
  private final Consumer<String> notices;
  private final Map<String, String> environment;

  /**
   * Creates a runtime from explicit collaborators.
   *
   * @param catalog component lookup table
   * @param metrics metrics sink shared by startup and request handling
   * @param binaries executable lookup used by validation
   * @param descriptors descriptor source, created only when a descriptor hint is given
   * @param servers builds the HTTP server for the resolved application
   * @param eventLoop blocks until interruption
   * @param notices receives operator notices written to stdout
   * @param environment variables consulted by {@code --use-environment}
   */
  public ServerRuntime(
      ComponentCatalog catalog,
      MetricsPort metrics,
      BinaryLocator binaries,
      Supplier<DescriptorSource> descriptors,
      BiFunction<ImagingApplication, MetricsPort, HttpServerPort> servers,
      EventLoop eventLoop,
      Consumer<String> notices,
      Map<String, String> environment) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.binaries = Objects.requireNonNull(binaries, "binaries");
    this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
    this.servers = Objects.requireNonNull(servers, "servers");
    this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    this.notices = Objects.requireNonNull(notices, "notices");
    this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
  }

  /**
   * Production wiring: built-in components, OpenTelemetry metrics, {@code PATH} lookup, libc
   * descriptors, Netty and JVM shutdown hooks.
   *
   * @return runtime bound to the current process
   */
  public static ServerRuntime system() {
    return new ServerRuntime(
        BuiltInComponents.catalog(),
        new OpenTelemetryMetricsAdapter(),
        new PathBinaryLocator(),
        NativeDescriptorSource::new,
        NettyHttpServer::new,
        new ShutdownHookEventLoop(),
        CliPrinter::println,
        System.getenv());
  }

  /**
   * Runs the bootstrap sequence and blocks until the server is interrupted.
   *
   * @param params parsed command line
   * @param verbose whether DEBUG logging was requested
   * @throws IOException if the listening socket cannot be acquired
   */
  public void launch(ServerParameters params, boolean verbose) throws IOException {
    Objects.requireNonNull(params, "params");
    Path configPath = params.configPath() != null
        ? params.configPath()
        : ConfigLoader.locateDefault().orElse(null);
    PrismConfig config = ConfigLoader.load(configPath, params.useEnvironment(), environment);

    LoggingConfigurator.configure(config, params.logLevel());
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
    }
    log.info("Starting PRISM with {}", params);
    log.debug("Configuration source: {}", configPath == null ? "<defaults>" : configPath);

    CompositionRoot root = new CompositionRoot(catalog, metrics);
    ComponentRegistry registry = root.resolve(config);

    StartupValidator validator = new StartupValidator(binaries);
    ServerParameters validated = validator.validate(config, params).applyTo(params);
    log.debug("Security key {}", Logs.redact(validated.securityKey()));

    ExecutionContext context = root.context(validated, config, registry);
    ImagingApplication application = root.application(context);

    HttpServerPort server = servers.apply(application, metrics);
    ServerLifecycle lifecycle = new ServerLifecycle(
        context, server, new LazyDescriptorSource(descriptors), eventLoop, notices);
    lifecycle.bind();
    lifecycle.run();
  }

  MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Unable to close metrics sink", ex);
      }
    }
  }

  /** Creates the underlying source on first use so address binding never loads libc. */
  private static final class LazyDescriptorSource implements DescriptorSource {
    private final Supplier<DescriptorSource> factory;
    private DescriptorSource delegate;

    private LazyDescriptorSource(Supplier<DescriptorSource> factory) {
      this.factory = factory;
    }

    @Override
    public ListeningSocket inherit(int fd) throws IOException {
      return delegate().inherit(fd);
    }

    @Override
    public ListeningSocket recover(Path path) throws IOException {
      return delegate().recover(path);
    }

    @Override
    public void close(ListeningSocket socket) throws IOException {
      delegate().close(socket);
    }

    private DescriptorSource delegate() {
      if (delegate == null) {
        delegate = Objects.requireNonNull(factory.get(), "descriptor source");
      }
      return delegate;
    }
  }
}
