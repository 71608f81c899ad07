package ca.gc.cra.prism.config;

/**
 * Declared value type of a configuration setting.
 *
 * <p>Environment overrides always arrive as strings; {@link PrismConfig} accessors coerce them back
 * to the declared type on read.</p>
 *
 * @since 0.1.0
 */
public enum SettingType {
  /** Free-form text such as a module name or path. */
  STRING,
  /** Base-10 integer. */
  INTEGER,
  /** Feature flag. */
  BOOLEAN,
  /** Nested key/value mapping. */
  MAPPING,
  /** Ordered list of strings. */
  LIST
}
