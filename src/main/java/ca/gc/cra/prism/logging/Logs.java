package ca.gc.cra.prism.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Logging hygiene helpers: credential redaction and bounded rendering of request details.
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String UNSET_PLACEHOLDER = "<unset>";

  private Logs() {
    // Utility
  }

  /**
   * Shortens a value to at most {@code maxBytes} UTF-8 bytes, noting the original size.
   *
   * @param value value to render; {@code null} renders as {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value, or its truncated prefix with a size suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Renders a secret for log output without revealing it.
   *
   * @param value secret value
   * @return {@code "<unset>"} for a null or empty secret, {@code "[REDACTED]"} otherwise
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? UNSET_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
