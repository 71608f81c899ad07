package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PrismConfigTest {
  private static final Setting MAX_AGE = new Setting(
      "MAX_AGE", SettingType.INTEGER, 86400, true, "Cache lifetime for served images in seconds");

  @Test
  void defaultsCoverEveryCatalogedSetting() {
    PrismConfig config = PrismConfig.defaults();

    for (Setting setting : Settings.all()) {
      assertTrue(config.contains(setting.name()), setting.name());
    }
    assertEquals("prism.engines.passthrough", config.getString(Settings.ENGINE));
    assertFalse(config.getBoolean(Settings.USE_GIFSICLE_ENGINE));
    assertTrue(config.getList(Settings.FILTERS).isEmpty());
    assertEquals("", config.getString(Settings.RESULT_STORAGE));
    assertTrue(config.getMapping(Settings.LOG_CONFIG).isEmpty());
  }

  @Test
  void typedAccessorsCoerceStringValues() {
    PrismConfig config = PrismConfig.of(Map.of(
        "USE_GIFSICLE_ENGINE", "True",
        "MAX_AGE", "9",
        "DETECTORS", "a.detector, b.detector"));

    assertTrue(config.getBoolean(Settings.USE_GIFSICLE_ENGINE));
    assertEquals(9, config.getInt(MAX_AGE));
    assertEquals(List.of("a.detector", "b.detector"), config.getList(Settings.DETECTORS));
  }

  @Test
  void getIntFallsBackToDefaultWhenValueIsNotNumeric() {
    PrismConfig config = PrismConfig.of(Map.of("MAX_AGE", "soon"));

    assertEquals(Optional.empty(), config.getInteger("MAX_AGE"));
    assertEquals(86400, config.getInt(MAX_AGE));
  }

  @Test
  void getIntegerRejectsValuesBeyondIntRange() {
    PrismConfig config = PrismConfig.of(Map.of("MAX_AGE", "2147483648", "SMALL", 3L));

    assertEquals(Optional.empty(), config.getInteger("MAX_AGE"));
    assertEquals(86400, config.getInt(MAX_AGE));
    assertEquals(Optional.of(3), config.getInteger("SMALL"));
  }

  @Test
  void unknownKeysAreRetained() {
    PrismConfig config = PrismConfig.of(Map.of("CUSTOM_THING", 3));

    assertEquals(3, config.get("CUSTOM_THING"));
    assertNull(config.get("NOT_THERE"));
    assertEquals("", config.getString("NOT_THERE"));
  }
}
