package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Strings;
import java.util.Objects;

/**
 * Declaration of a single configuration setting.
 *
 * @param name upper-case setting name as written in the config file and the environment
 * @param type declared value type
 * @param defaultValue value used when neither the file nor the environment supplies one
 * @param environmentOverride whether a like-named environment variable may replace the value
 * @param description operator-facing summary
 * @since 0.1.0
 */
public record Setting(
    String name,
    SettingType type,
    Object defaultValue,
    boolean environmentOverride,
    String description) {

  public Setting {
    name = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(description, "description");
  }
}
