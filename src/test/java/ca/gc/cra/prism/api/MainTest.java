package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.DescriptorSource;
import ca.gc.cra.prism.application.port.HttpServerPort;
import ca.gc.cra.prism.application.server.ListeningSocket;
import ca.gc.cra.prism.application.server.ServerLifecycle;
import ca.gc.cra.prism.application.server.ShutdownSignal;
import ca.gc.cra.prism.config.BuiltInComponents;
import ca.gc.cra.prism.testutil.RecordingMetrics;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private final StringWriter out = new StringWriter();
  private final List<String> notices = new ArrayList<>();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private FakeServer server;

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
    server = new FakeServer(false);
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsageWithoutStarting() {
    ExitCode exit = Main.run(new String[] {"--help"}, this::runtime);

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(out.toString().contains("--use-environment"));
    assertTrue(server.calls.isEmpty());
  }

  @Test
  void invalidArgumentsPrintSummaryUsage() {
    ExitCode exit = Main.run(new String[] {"port=abc"}, this::runtime);

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(out.toString().startsWith("usage: prism"));
    assertTrue(server.calls.isEmpty());
  }

  @Test
  void unknownArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"colour=blue"}, this::runtime));
  }

  @Test
  void serverRunsUntilInterruptedThenExitsCleanly() throws IOException {
    Path conf = config("SECURITY_KEY: main-test-key\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "port=9123", "ip=127.0.0.1", "log-level=info"},
        this::runtime);

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(List.of("bind 127.0.0.1:9123", "start 1", "stop"), server.calls);
    assertEquals(List.of(ServerLifecycle.CLOSED_NOTICE), notices);
    assertEquals(1, metrics.counter("startup.components.resolved"));
  }

  @Test
  void keyfileSuppliesCredentialWhenConfigHasNone() throws IOException {
    Path conf = config("HEALTHCHECK_ROUTE: /ping\n");
    Path keyfile = Files.writeString(tempDir.resolve("key"), "from-file\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "keyfile=" + keyfile, "log-level=info"},
        this::runtime);

    assertEquals(ExitCode.SUCCESS, exit);
  }

  @Test
  void missingSecurityKeyIsConfigurationError() throws IOException {
    Path conf = config("HEALTHCHECK_ROUTE: /ping\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "log-level=info"}, this::runtime);

    assertEquals(ExitCode.CONFIG_ERROR, exit);
    assertTrue(server.calls.isEmpty());
  }

  @Test
  void unknownEngineIsResolutionError() throws IOException {
    Path conf = config("SECURITY_KEY: k\nENGINE: no.such.engine\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "log-level=info"}, this::runtime);

    assertEquals(ExitCode.RESOLUTION_ERROR, exit);
  }

  @Test
  void unknownApplicationIsResolutionError() throws IOException {
    Path conf = config("SECURITY_KEY: k\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "app=no.such.app", "log-level=info"},
        this::runtime);

    assertEquals(ExitCode.RESOLUTION_ERROR, exit);
  }

  @Test
  void bindFailureIsIoError() throws IOException {
    server = new FakeServer(true);
    Path conf = config("SECURITY_KEY: k\n");

    ExitCode exit = Main.run(new String[] {"conf=" + conf, "log-level=info"}, this::runtime);

    assertEquals(ExitCode.IO_ERROR, exit);
    assertFalse(server.calls.contains("start 1"));
    assertTrue(notices.isEmpty());
  }

  @Test
  void absentConfigFileFallsBackToDefaults() throws IOException {
    Path keyfile = Files.writeString(tempDir.resolve("key"), "k");

    ExitCode exit = Main.run(
        new String[] {"conf=" + tempDir.resolve("absent.yaml"), "keyfile=" + keyfile, "log-level=info"},
        this::runtime);

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(List.of("bind 0.0.0.0:8888", "start 1", "stop"), server.calls);
  }

  private Path config(String yaml) throws IOException {
    return Files.writeString(tempDir.resolve("prism.yaml"), yaml);
  }

  private ServerRuntime runtime() {
    return new ServerRuntime(
        BuiltInComponents.catalog(),
        metrics,
        name -> Optional.empty(),
        UnusedDescriptors::new,
        (application, sink) -> server,
        ShutdownSignal::trigger,
        notices::add,
        Map.of());
  }

  private static final class FakeServer implements HttpServerPort {
    final List<String> calls = new ArrayList<>();
    private final boolean failBind;

    FakeServer(boolean failBind) {
      this.failBind = failBind;
    }

    @Override
    public void bind(int port, String address) throws IOException {
      calls.add("bind " + address + ":" + port);
      if (failBind) {
        throw new IOException("Address already in use");
      }
    }

    @Override
    public void addSocket(ListeningSocket socket) {
      calls.add("socket " + socket.fd());
    }

    @Override
    public void start(int workers) {
      calls.add("start " + workers);
    }

    @Override
    public void stop() {
      calls.add("stop");
    }
  }

  private static final class UnusedDescriptors implements DescriptorSource {
    @Override
    public ListeningSocket inherit(int fd) {
      throw new AssertionError("descriptor source should not be used for address binding");
    }

    @Override
    public ListeningSocket recover(Path path) {
      throw new AssertionError("descriptor source should not be used for address binding");
    }

    @Override
    public void close(ListeningSocket socket) {
      throw new AssertionError("descriptor source should not be used for address binding");
    }
  }
}
