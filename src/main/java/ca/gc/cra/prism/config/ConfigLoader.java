package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads {@link PrismConfig} instances from YAML configuration files.
 * <p><strong>Why:</strong> Allows operators to override default settings via a config file and, when
 * asked to, via the process environment.</p>
 * <p><strong>Role:</strong> Configuration helper used by the CLI bootstrap.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Performance:</strong> O(n) in the number of settings.</p>
 *
 * <p>The file is a single YAML mapping of {@code SETTING_NAME: value}. A missing or unreadable file is
 * not an error: the result then holds only defaults (plus environment overrides when enabled).</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
  private static final String DEFAULT_FILE_NAME = "prism.yaml";

  private ConfigLoader() {}

  /**
   * Loads configuration from {@code path}, consulting the process environment when allowed.
   *
   * @param path YAML file; may be {@code null} or non-existent to use defaults
   * @param allowEnvironmentOverride whether override-eligible settings may be replaced by
   *     like-named environment variables
   * @return effective configuration
   * @throws ConfigurationException if the file exists and is readable but is not a valid YAML mapping
   */
  public static PrismConfig load(Path path, boolean allowEnvironmentOverride) {
    return load(path, allowEnvironmentOverride, System.getenv());
  }

  /**
   * Loads configuration from {@code path} using an explicit environment.
   *
   * @param path YAML file; may be {@code null} or non-existent to use defaults
   * @param allowEnvironmentOverride whether {@code environment} is consulted at all
   * @param environment variable name to value
   * @return effective configuration
   * @throws ConfigurationException if the file exists and is readable but is not a valid YAML mapping
   */
  public static PrismConfig load(
      Path path, boolean allowEnvironmentOverride, Map<String, String> environment) {
    Map<String, Object> values = new LinkedHashMap<>(readFile(path));
    if (allowEnvironmentOverride && environment != null) {
      applyEnvironment(values, environment);
    }
    return PrismConfig.of(values);
  }

  /**
   * Finds the first existing default config file: {@code ./prism.yaml}, {@code ~/prism.yaml},
   * {@code /etc/prism.yaml}.
   *
   * @return located file, or empty when none exists
   */
  public static Optional<Path> locateDefault() {
    String home = System.getProperty("user.home", ".");
    return locateDefault(List.of(
        Path.of(DEFAULT_FILE_NAME),
        Path.of(home, DEFAULT_FILE_NAME),
        Path.of("/etc", DEFAULT_FILE_NAME)));
  }

  static Optional<Path> locateDefault(List<Path> candidates) {
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private static Map<String, Object> readFile(Path path) {
    if (path == null) {
      log.debug("No configuration file given; using defaults");
      return Map.of();
    }
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      log.info("Configuration file {} not found or unreadable; using defaults", path);
      return Map.of();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (IOException ex) {
      log.warn("Unable to read configuration file {}; using defaults", path, ex);
      return Map.of();
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse configuration file at " + path, ex);
    }

    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new ConfigurationException("Configuration file " + path + " must contain a mapping of settings");
    }

    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new ConfigurationException("Configuration file " + path + " contains a non-string or blank key");
      }
      if (Settings.find(key).isEmpty()) {
        log.warn("Unknown setting {} in {}", key, path);
      }
      values.put(key, entry.getValue());
    }
    log.debug("Loaded {} settings from {}", values.size(), path);
    return values;
  }

  private static void applyEnvironment(Map<String, Object> values, Map<String, String> environment) {
    for (Setting setting : Settings.all()) {
      if (!setting.environmentOverride()) {
        continue;
      }
      String override = environment.get(setting.name());
      if (override != null) {
        log.debug("Environment overrides setting {}", setting.name());
        values.put(setting.name(), override);
      }
    }
  }
}
