package ca.gc.cra.prism.config;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of every setting PRISM understands, with defaults and environment-override eligibility.
 *
 * <p>The catalog is the single source of truth for defaults; {@link PrismConfig#defaults()} is built
 * from it and {@link ConfigLoader} consults it to decide which environment variables apply.</p>
 *
 * @since 0.1.0
 */
public final class Settings {
  private static final Map<String, Setting> ALL = new LinkedHashMap<>();

  public static final Setting SECURITY_KEY = define(
      "SECURITY_KEY", SettingType.STRING, "", true,
      "Shared secret used to sign image URLs");
  public static final Setting ENGINE = define(
      "ENGINE", SettingType.STRING, "prism.engines.passthrough", true,
      "Imaging engine module instantiated per request");
  public static final Setting GIF_ENGINE = define(
      "GIF_ENGINE", SettingType.STRING, "prism.engines.gifsicle", true,
      "Engine used for animated images when USE_GIFSICLE_ENGINE is enabled");
  public static final Setting USE_GIFSICLE_ENGINE = define(
      "USE_GIFSICLE_ENGINE", SettingType.BOOLEAN, Boolean.FALSE, true,
      "Process animated GIFs with the external gifsicle binary");
  public static final Setting LOADER = define(
      "LOADER", SettingType.STRING, "prism.loaders.none", true,
      "Loader module that fetches source images");
  public static final Setting STORAGE = define(
      "STORAGE", SettingType.STRING, "prism.storages.none", true,
      "Storage module for original images");
  public static final Setting RESULT_STORAGE = define(
      "RESULT_STORAGE", SettingType.STRING, "", true,
      "Storage module for transformed images; blank disables result storage");
  public static final Setting DETECTORS = define(
      "DETECTORS", SettingType.LIST, List.of(), true,
      "Focal point detector modules run for smart cropping");
  public static final Setting FILTERS = define(
      "FILTERS", SettingType.LIST, List.of(), false,
      "Filter modules available to requests");
  public static final Setting USE_CUSTOM_ERROR_HANDLING = define(
      "USE_CUSTOM_ERROR_HANDLING", SettingType.BOOLEAN, Boolean.FALSE, true,
      "Report request failures to ERROR_HANDLER_MODULE");
  public static final Setting ERROR_HANDLER_MODULE = define(
      "ERROR_HANDLER_MODULE", SettingType.STRING, "prism.errors.logging", true,
      "Error handler module constructed when custom error handling is enabled");
  public static final Setting LOG_CONFIG = define(
      "PRISM_LOG_CONFIG", SettingType.MAPPING, Map.of(), false,
      "Structured logging configuration applied instead of the basic console setup");
  public static final Setting HEALTHCHECK_ROUTE = define(
      "HEALTHCHECK_ROUTE", SettingType.STRING, "/healthcheck", true,
      "Path answered with 200 WORKING by the service application");

  private Settings() {}

  /**
   * Returns every known setting in declaration order.
   *
   * @return immutable view of the catalog
   */
  public static Collection<Setting> all() {
    return List.copyOf(ALL.values());
  }

  /**
   * Looks up a setting by name.
   *
   * @param name setting name (case-sensitive)
   * @return the declaration, or empty when the name is not part of the catalog
   */
  public static Optional<Setting> find(String name) {
    return Optional.ofNullable(ALL.get(name));
  }

  private static Setting define(
      String name, SettingType type, Object defaultValue, boolean environmentOverride, String description) {
    Setting setting = new Setting(name, type, defaultValue, environmentOverride, description);
    ALL.put(name, setting);
    return setting;
  }
}
