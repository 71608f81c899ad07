package ca.gc.cra.prism.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable PRISM configuration: every catalogued setting with its effective value.
 * <p><strong>Why:</strong> Gives the importer, validator and request layer one read-only view of the
 * merged defaults, file values and environment overrides.</p>
 * <p><strong>Role:</strong> Configuration value object built once by {@link ConfigLoader}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across request handlers.</p>
 *
 * <p>Typed accessors coerce values that arrived as strings (environment overrides) back to the
 * declared type. Keys outside the {@link Settings} catalog are retained and reachable through
 * {@link #get(String)}.</p>
 *
 * @since 0.1.0
 */
public final class PrismConfig {
  private final Map<String, Object> values;

  private PrismConfig(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns a configuration populated only with catalogue defaults.
   *
   * @return default configuration
   */
  public static PrismConfig defaults() {
    return of(Map.of());
  }

  /**
   * Returns defaults overlaid with the supplied values.
   *
   * @param overrides setting name to value; {@code null} values are kept and read back as unset
   * @return merged configuration
   */
  public static PrismConfig of(Map<String, ?> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    Map<String, Object> merged = new LinkedHashMap<>();
    for (Setting setting : Settings.all()) {
      merged.put(setting.name(), setting.defaultValue());
    }
    merged.putAll(overrides);
    return new PrismConfig(merged);
  }

  /**
   * Returns the raw stored value.
   *
   * @param key setting name
   * @return stored value or {@code null} when unset or unknown
   */
  public Object get(String key) {
    return values.get(key);
  }

  /**
   * Indicates whether the key has an entry (default, file or environment).
   *
   * @param key setting name
   * @return {@code true} if present
   */
  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public String getString(String key) {
    Object value = values.get(key);
    return value == null ? "" : value.toString();
  }

  public String getString(Setting setting) {
    return getString(setting.name());
  }

  /**
   * Reads a flag, accepting {@code Boolean}, numbers and the spellings of {@link ConfigValues#coerceBoolean}.
   *
   * @param key setting name
   * @return flag value; unrecognised or absent values read as {@code false}
   */
  public boolean getBoolean(String key) {
    Object value = values.get(key);
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof Number number) {
      return number.longValue() != 0;
    }
    if (value instanceof String text) {
      return ConfigValues.coerceBoolean(text).orElse(false);
    }
    return false;
  }

  public boolean getBoolean(Setting setting) {
    return getBoolean(setting.name());
  }

  /**
   * Reads an integer.
   *
   * @param key setting name
   * @return value, or empty when absent, not numeric or outside the {@code int} range
   */
  public Optional<Integer> getInteger(String key) {
    Object value = values.get(key);
    Optional<Long> number = Optional.empty();
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      number = Optional.of(((Number) value).longValue());
    } else if (value instanceof String text) {
      number = ConfigValues.coerceInteger(text);
    }
    return number
        .filter(n -> n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE)
        .map(Long::intValue);
  }

  /**
   * Reads an integer, falling back to the catalogue default when the stored value does not coerce.
   *
   * @param setting integer setting
   * @return effective value
   */
  public int getInt(Setting setting) {
    return getInteger(setting.name())
        .orElseGet(() -> ((Number) setting.defaultValue()).intValue());
  }

  /**
   * Reads a list of strings; a string value is split on commas.
   *
   * @param key setting name
   * @return immutable list, empty when absent
   */
  public List<String> getList(String key) {
    Object value = values.get(key);
    if (value instanceof String text) {
      return List.copyOf(ConfigValues.splitList(text));
    }
    if (value instanceof Iterable<?> iterable) {
      List<String> entries = new ArrayList<>();
      for (Object entry : iterable) {
        if (entry != null && !entry.toString().isBlank()) {
          entries.add(entry.toString().trim());
        }
      }
      return List.copyOf(entries);
    }
    return List.of();
  }

  public List<String> getList(Setting setting) {
    return getList(setting.name());
  }

  /**
   * Reads a nested mapping.
   *
   * @param key setting name
   * @return immutable mapping with string keys, empty when absent or not a mapping
   */
  public Map<String, Object> getMapping(String key) {
    Object value = values.get(key);
    if (!(value instanceof Map<?, ?> raw)) {
      return Map.of();
    }
    Map<String, Object> mapping = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() != null) {
        mapping.put(entry.getKey().toString(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(mapping);
  }

  public Map<String, Object> getMapping(Setting setting) {
    return getMapping(setting.name());
  }

  /**
   * Returns every stored entry.
   *
   * @return unmodifiable view in insertion order
   */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "PrismConfig" + values.keySet();
  }
}
