package ca.gc.cra.prism.domain.http;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport-neutral HTTP request handed to the application.
 *
 * <p>Header names are stored lower-cased; the path excludes the query string.</p>
 *
 * @since 0.1.0
 */
public final class HttpRequestMessage {
  private final String method;
  private final String path;
  private final String query;
  private final Map<String, String> headers;
  private final byte[] body;

  public HttpRequestMessage(String method, String uri, Map<String, String> headers, byte[] body) {
    this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
    String target = Objects.requireNonNull(uri, "uri");
    int q = target.indexOf('?');
    this.path = q < 0 ? target : target.substring(0, q);
    this.query = q < 0 ? "" : target.substring(q + 1);
    Map<String, String> normalized = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
    }
    this.headers = Map.copyOf(normalized);
    this.body = body == null ? new byte[0] : body.clone();
  }

  public static HttpRequestMessage get(String uri) {
    return new HttpRequestMessage("GET", uri, Map.of(), null);
  }

  public String method() {
    return method;
  }

  public String path() {
    return path;
  }

  public String query() {
    return query;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public Optional<String> header(String name) {
    return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
  }

  public byte[] body() {
    return body.clone();
  }

  @Override
  public String toString() {
    return "HttpRequestMessage[" + method + " " + path + (query.isEmpty() ? "" : "?" + query)
        + ", headers=" + headers.keySet() + ", bodyBytes=" + body.length + "]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HttpRequestMessage other)) {
      return false;
    }
    return method.equals(other.method)
        && path.equals(other.path)
        && query.equals(other.query)
        && headers.equals(other.headers)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, path, query, headers) * 31 + Arrays.hashCode(body);
  }
}
