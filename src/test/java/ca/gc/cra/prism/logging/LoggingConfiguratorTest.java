package ca.gc.cra.prism.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.config.ConfigurationException;
import ca.gc.cra.prism.config.PrismConfig;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

  @Test
  void emptyLogConfigYieldsBasicSetupAtCommandLineLevel() {
    LoggingSetup setup = LoggingConfigurator.plan(PrismConfig.defaults(), "warning");

    assertFalse(setup.structured());
    assertEquals(Level.WARN, setup.rootLevel());
    assertEquals("%d{yyyy-MM-dd HH:mm:ss} %logger:%level %msg%n", setup.pattern());
    assertTrue(setup.loggerLevels().isEmpty());
  }

  @Test
  void structuredConfigIsHonouredAsGiven() {
    PrismConfig config = PrismConfig.of(Map.of("PRISM_LOG_CONFIG", Map.of(
        "level", "INFO",
        "loggers", Map.of("io.netty", "ERROR"),
        "format", "%d %level %msg%n",
        "datefmt", "HH:mm")));

    LoggingSetup setup = LoggingConfigurator.plan(config, "debug");

    assertTrue(setup.structured());
    assertEquals(Level.INFO, setup.rootLevel());
    assertEquals(Map.of("io.netty", Level.ERROR), setup.loggerLevels());
    assertEquals("%d{HH:mm} %level %msg%n", setup.pattern());
  }

  @Test
  void structuredConfigWithoutLevelKeepsCommandLineLevel() {
    PrismConfig config = PrismConfig.of(Map.of("PRISM_LOG_CONFIG", Map.of("datefmt", "HH:mm:ss")));

    LoggingSetup setup = LoggingConfigurator.plan(config, "critical");

    assertEquals(Level.ERROR, setup.rootLevel());
    assertEquals("%d{HH:mm:ss} %logger:%level %msg%n", setup.pattern());
  }

  @Test
  void badStructuredLevelIsConfigurationError() {
    PrismConfig config = PrismConfig.of(Map.of("PRISM_LOG_CONFIG", Map.of("level", "LOUD")));

    assertThrows(ConfigurationException.class, () -> LoggingConfigurator.plan(config, "info"));
  }

  @Test
  void loggersMustBeMapping() {
    PrismConfig config = PrismConfig.of(Map.of("PRISM_LOG_CONFIG", Map.of("loggers", List.of("a"))));

    assertThrows(ConfigurationException.class, () -> LoggingConfigurator.plan(config, "info"));
  }

  @Test
  void unknownCommandLineLevelIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.toLevel("chatty"));
  }

  @Test
  void pythonStyleLevelNamesAreAccepted() {
    assertEquals(Level.WARN, LoggingConfigurator.toLevel("WARNING"));
    assertEquals(Level.ERROR, LoggingConfigurator.toLevel("critical"));
    assertEquals(Level.ALL, LoggingConfigurator.toLevel("NOTSET"));
  }

  @Test
  void applyReplacesRootAppenderOnFreshContext() {
    LoggerContext context = new LoggerContext();
    LoggingSetup setup = new LoggingSetup(
        Level.INFO, Map.of("prism.errors", Level.ERROR), LoggingConfigurator.BASIC_PATTERN, false);

    setup.apply(context);

    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertEquals(Level.INFO, root.getLevel());
    assertEquals(Level.ERROR, context.getLogger("prism.errors").getLevel());
    Iterator<Appender<ILoggingEvent>> appenders = root.iteratorForAppenders();
    Appender<ILoggingEvent> appender = appenders.next();
    assertFalse(appenders.hasNext());
    assertEquals("PRISM_CONSOLE", appender.getName());
    ConsoleAppender<ILoggingEvent> console = assertInstanceOf(ConsoleAppender.class, appender);
    PatternLayoutEncoder encoder = assertInstanceOf(PatternLayoutEncoder.class, console.getEncoder());
    assertEquals(LoggingConfigurator.BASIC_PATTERN, encoder.getPattern());
    context.stop();
  }
}
