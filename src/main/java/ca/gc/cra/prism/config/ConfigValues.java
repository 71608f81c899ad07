package ca.gc.cra.prism.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient coercions for configuration values that may arrive as plain strings.
 *
 * <p>None of these helpers throw on malformed input; they return an empty result and leave the
 * decision to the caller.</p>
 *
 * @since 0.1.0
 */
public final class ConfigValues {

  private ConfigValues() {}

  /**
   * Parses a base-10 integer.
   *
   * <p>The result is not narrowed: {@code "2147483648"} is still a number, and range checks belong to
   * the caller.</p>
   *
   * @param raw candidate text; may be {@code null}
   * @return the parsed value, or empty for {@code null}, blank or non-numeric input, or digits beyond
   *     the {@code long} range
   */
  public static Optional<Long> coerceInteger(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(trimmed, 10));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  /**
   * Parses a flag written as {@code true/false}, {@code 1/0}, {@code yes/no} or {@code on/off}.
   *
   * @param raw candidate text; may be {@code null}
   * @return the parsed flag, or empty when the text is not a recognised spelling
   */
  public static Optional<Boolean> coerceBoolean(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> Optional.of(Boolean.TRUE);
      case "false", "0", "no", "off", "" -> Optional.of(Boolean.FALSE);
      default -> Optional.empty();
    };
  }

  /**
   * Splits a comma-separated value into trimmed, non-empty entries.
   *
   * @param raw candidate text; may be {@code null}
   * @return list of entries in input order; empty when {@code raw} is {@code null} or blank
   */
  public static List<String> splitList(String raw) {
    List<String> entries = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return entries;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        entries.add(trimmed);
      }
    }
    return entries;
  }
}
