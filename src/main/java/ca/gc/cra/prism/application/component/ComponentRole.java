package ca.gc.cra.prism.application.component;

/**
 * Pluggable roles resolved at startup, with the setting that names each one.
 *
 * @since 0.1.0
 */
public enum ComponentRole {
  ENGINE("engine", "ENGINE"),
  GIF_ENGINE("gif engine", "GIF_ENGINE"),
  FILTER("filter", "FILTERS"),
  ERROR_HANDLER("error handler", "ERROR_HANDLER_MODULE"),
  LOADER("loader", "LOADER"),
  STORAGE("storage", "STORAGE"),
  RESULT_STORAGE("result storage", "RESULT_STORAGE"),
  DETECTOR("detector", "DETECTORS"),
  APPLICATION("application", "app");

  private final String label;
  private final String settingName;

  ComponentRole(String label, String settingName) {
    this.label = label;
    this.settingName = settingName;
  }

  /**
   * Returns the human-readable role name used in diagnostics.
   *
   * @return label such as {@code "result storage"}
   */
  public String label() {
    return label;
  }

  /**
   * Returns the configuration setting (or CLI key, for the application) naming this role.
   *
   * @return setting name
   */
  public String settingName() {
    return settingName;
  }
}
