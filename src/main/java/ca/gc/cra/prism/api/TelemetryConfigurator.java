package ca.gc.cra.prism.api;

import ca.gc.cra.prism.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry CLI arguments into the system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  private static final Set<String> EXPORTERS = Set.of("otlp", "none");

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_ATTRIBUTES_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code args}. Keys that are absent leave the corresponding property untouched. The overrides that
   * took effect are logged once at INFO; resource attribute values are summarised by key only.
   *
   * @param args mutable argument map; telemetry keys are removed
   * @throws IllegalArgumentException if a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    Map<String, String> applied = new LinkedHashMap<>();
    String exporter = args.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!EXPORTERS.contains(normalized)) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty(EXPORTER_PROPERTY, normalized);
      applied.put("exporter", normalized);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty(ENDPOINT_PROPERTY, trimmed);
      applied.put("endpoint", trimmed);
    }

    String attributes = args.remove("otelResourceAttributes");
    if (attributes != null && !attributes.isBlank()) {
      String trimmed = attributes.trim();
      Strings.requirePrintableAscii("otelResourceAttributes", trimmed, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OpenTelemetry resource attributes override");
      System.setProperty(RESOURCE_ATTRIBUTES_PROPERTY, trimmed);
      applied.put("resourceAttributes", attributeKeys(trimmed));
    }

    if (!applied.isEmpty()) {
      log.info("PRISM telemetry overrides applied: {}", applied);
    }
  }

  private static String attributeKeys(String attributes) {
    StringBuilder keys = new StringBuilder("[");
    for (String pair : attributes.split(",")) {
      int idx = pair.indexOf('=');
      String key = (idx < 0 ? pair : pair.substring(0, idx)).trim();
      if (key.isEmpty()) {
        continue;
      }
      if (keys.length() > 1) {
        keys.append(", ");
      }
      keys.append(key);
    }
    return keys.append(']').toString();
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
