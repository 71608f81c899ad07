package ca.gc.cra.prism.domain.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Transport-neutral HTTP response produced by the application.
 *
 * @since 0.1.0
 */
public final class HttpResponseMessage {
  private static final String TEXT_PLAIN = "text/plain; charset=UTF-8";

  private final int status;
  private final String contentType;
  private final byte[] body;

  public HttpResponseMessage(int status, String contentType, byte[] body) {
    if (status < 100 || status > 599) {
      throw new IllegalArgumentException("status must be between 100 and 599 (was " + status + ")");
    }
    this.status = status;
    this.contentType = Objects.requireNonNull(contentType, "contentType");
    this.body = body == null ? new byte[0] : body.clone();
  }

  public static HttpResponseMessage text(int status, String text) {
    return new HttpResponseMessage(status, TEXT_PLAIN, text.getBytes(StandardCharsets.UTF_8));
  }

  public int status() {
    return status;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Returns the response payload.
   *
   * @return internal payload array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Body is copied on construction; the transport writes the canonical buffer without another copy per response.")
  public byte[] body() {
    return body;
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "HttpResponseMessage[" + status + ", " + contentType + ", bodyBytes=" + body.length + "]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HttpResponseMessage other)) {
      return false;
    }
    return status == other.status && contentType.equals(other.contentType) && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, contentType) * 31 + Arrays.hashCode(body);
  }
}
