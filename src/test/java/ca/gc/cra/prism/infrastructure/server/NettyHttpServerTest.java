package ca.gc.cra.prism.infrastructure.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.server.ListeningSocket;
import ca.gc.cra.prism.infrastructure.app.ImagingServiceApp;
import ca.gc.cra.prism.testutil.Contexts;
import ca.gc.cra.prism.testutil.RecordingMetrics;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class NettyHttpServerTest {

  private final RecordingMetrics metrics = new RecordingMetrics();
  private NettyHttpServer server;

  @AfterEach
  void stopServer() {
    if (server != null) {
      server.stop();
    }
  }

  @Test
  void servesHealthcheckOverLoopback() throws Exception {
    server = new NettyHttpServer(new ImagingServiceApp(Contexts.of(Map.of(), metrics)), metrics);
    server.bind(0, "127.0.0.1");
    server.start(1);

    int port = ((InetSocketAddress) server.boundAddresses().get(0)).getPort();
    HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    HttpResponse<String> ok = client.send(
        HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/healthcheck")).build(),
        HttpResponse.BodyHandlers.ofString());
    HttpResponse<String> missing = client.send(
        HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/unsafe/100x100/img.png")).build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(200, ok.statusCode());
    assertEquals("WORKING", ok.body());
    assertEquals(404, missing.statusCode());
    assertEquals(2, metrics.counter("http.requests"));
    assertEquals(1, metrics.counter("http.responses.2xx"));
    assertEquals(1, metrics.counter("http.responses.4xx"));
  }

  @Test
  void bindFailsWhenAddressInUse() throws IOException {
    try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      server = new NettyHttpServer(request -> null, metrics);

      assertThrows(IOException.class, () -> server.bind(occupied.getLocalPort(), "127.0.0.1"));
    }
  }

  @Test
  void startWithoutSocketFails() {
    server = new NettyHttpServer(request -> null, metrics);

    assertThrows(IllegalStateException.class, () -> server.start(1));
  }

  @Test
  void stopIsIdempotentAndBlocksRestart() throws IOException {
    server = new NettyHttpServer(request -> null, metrics);
    server.bind(0, "127.0.0.1");

    server.stop();
    server.stop();

    assertTrue(server.boundAddresses().isEmpty());
    assertThrows(IllegalStateException.class,
        () -> server.addSocket(new ListeningSocket(3, ListeningSocket.Origin.INHERITED, "3")));
  }
}
