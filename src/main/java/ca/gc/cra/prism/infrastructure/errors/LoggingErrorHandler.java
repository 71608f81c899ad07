package ca.gc.cra.prism.infrastructure.errors;

import ca.gc.cra.prism.application.port.ErrorHandler;
import ca.gc.cra.prism.application.startup.ExecutionContext;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.domain.http.HttpRequestMessage;
import ca.gc.cra.prism.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Error handler that reports request failures as one JSON document per line on a dedicated SLF4J logger.
 *
 * <p>Registered as {@code prism.errors.logging}. Enable with {@code USE_CUSTOM_ERROR_HANDLING}.
 * Credential-bearing headers are redacted.</p>
 */
public final class LoggingErrorHandler implements ErrorHandler {
  public static final String NAME = "prism.errors.logging";
  static final String LOGGER_NAME = "prism.errors";
  private static final int MAX_DETAIL_BYTES = 512;
  private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

  private final Logger errors;
  private final JsonFactory json = new JsonFactory();

  public LoggingErrorHandler(PrismConfig config) {
    Objects.requireNonNull(config, "config");
    this.errors = LoggerFactory.getLogger(LOGGER_NAME);
  }

  @Override
  public void handleError(ExecutionContext context, HttpRequestMessage request, Throwable cause) {
    errors.error(report(request, cause), cause);
    context.metrics().increment("http.errors.reported");
  }

  String report(HttpRequestMessage request, Throwable cause) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = json.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeObjectFieldStart("http");
      gen.writeStringField("method", request.method());
      gen.writeStringField("path", Logs.truncate(request.path(), MAX_DETAIL_BYTES));
      gen.writeStringField("query", Logs.truncate(request.query(), MAX_DETAIL_BYTES));
      gen.writeObjectFieldStart("headers");
      for (Map.Entry<String, String> header : request.headers().entrySet()) {
        String name = header.getKey();
        String value = SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT))
            ? Logs.redact(header.getValue())
            : Logs.truncate(header.getValue(), MAX_DETAIL_BYTES);
        gen.writeStringField(name, value);
      }
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeObjectFieldStart("error");
      gen.writeStringField("type", cause.getClass().getName());
      gen.writeStringField("message", Logs.truncate(String.valueOf(cause.getMessage()), MAX_DETAIL_BYTES));
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      // StringWriter does not fail; keep the plain form if the generator does.
      return "Request " + request.method() + " " + request.path() + " failed: " + cause;
    }
    return out.toString();
  }
}
