package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.component.ComponentResolutionException;
import ca.gc.cra.prism.config.ConfigurationException;
import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PRISM server entry point.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: prism [key=value ...] [--debug] [--use-environment]";
  private static final String HELP_TEXT = """
      PRISM imaging server

      Usage:
        prism [key=value ...] [flags]

      Options:
        port=N                   Port to listen on (default 8888)
        ip=ADDR                  Address to bind (default 0.0.0.0)
        fd=N|PATH                Adopt an inherited descriptor number, or the descriptor behind PATH
        conf=PATH                YAML configuration file (default: ./prism.yaml, ~/prism.yaml, /etc/prism.yaml)
        keyfile=PATH             File holding the security key
        log-level=LEVEL          debug, info, warning, error or critical (default warning)
        app=NAME                 Application to serve (default prism.app.imaging)
        metricsExporter=otlp|none
        otelEndpoint=URL         OTLP collector endpoint
        otelResourceAttributes=K=V,...

      Flags:
        --debug                  Debug mode; implies --verbose
        --use-environment        Let environment variables override configuration settings
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the server and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS} after an interruption, otherwise the code of the startup failure
   */
  static ExitCode run(String[] args) {
    return run(args, ServerRuntime::system);
  }

  static ExitCode run(String[] args, Supplier<ServerRuntime> runtimes) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ServerParameters params;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      params = ServerParametersParser.parse(kv, input);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (ServerRuntime runtime = runtimes.get()) {
      runtime.launch(params, input.verbose());
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (ComponentResolutionException ex) {
      log.error("Component resolution failed: {}", ex.getMessage());
      return ExitCode.RESOLUTION_ERROR;
    } catch (IOException ex) {
      log.error("Unable to acquire listening socket: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage(), ex);
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("PRISM failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
