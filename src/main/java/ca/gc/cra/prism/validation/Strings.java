package ca.gc.cra.prism.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Text checks applied to CLI arguments, key files and telemetry overrides.
 * <p><strong>Role:</strong> Shared by {@code api} parsers and {@link Net}; failures surface as
 * {@link IllegalArgumentException} so {@code Main} reports them as argument errors.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final String DEFAULT_LABEL = "value";

  private Strings() {
    // Utility
  }

  /**
   * Trims an argument and rejects it when nothing is left or it carries control characters.
   *
   * @param name argument name used in messages
   * @param value raw argument text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the text is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Like {@link #requireNonBlank(String, String)}, and additionally limits the text to
   * {@code maxLength} characters in the range {@code 0x20..0x7E}.
   *
   * @param name argument name used in messages
   * @param value raw argument text
   * @param maxLength longest accepted length
   * @return trimmed text
   * @throws IllegalArgumentException if the text is too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " must be at most " + maxLength + " characters");
    }
    boolean printable = trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E);
    if (!printable) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters only");
    }
    return trimmed;
  }

  private static String label(String name) {
    return isBlank(name) ? DEFAULT_LABEL : name;
  }
}
