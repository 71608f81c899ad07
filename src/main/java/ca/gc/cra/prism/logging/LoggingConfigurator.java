package ca.gc.cra.prism.logging;

import ca.gc.cra.prism.config.ConfigurationException;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.config.Settings;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures PRISM runtime logging from the configuration and the CLI log level.
 * <p><strong>Why:</strong> Lets operators choose between a plain console format and a structured
 * {@code PRISM_LOG_CONFIG} mapping without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges settings to the logging backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Plan a {@link LoggingSetup} from configuration and level.</li>
 *   <li>Apply the plan to the active Logback context.</li>
 *   <li>Warn when the backend does not support dynamic changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see LoggingSetup
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Date pattern of the basic console format. */
  public static final String BASIC_DATE_FORMAT = "yyyy-MM-dd HH:mm:ss";
  /** Line pattern of the basic console format. */
  public static final String BASIC_PATTERN = "%d{" + BASIC_DATE_FORMAT + "} %logger:%level %msg%n";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Decides the logging setup.
   *
   * <p>A non-empty {@code PRISM_LOG_CONFIG} mapping wins and is honoured as given through its
   * {@code level}, {@code loggers}, {@code format} and {@code datefmt} keys; otherwise the basic
   * console format is used at {@code level}.</p>
   *
   * @param config effective configuration
   * @param level root level name from the command line (Python-style names accepted)
   * @return logging plan
   * @throws ConfigurationException if a level in {@code PRISM_LOG_CONFIG} is not recognised
   * @throws IllegalArgumentException if {@code level} is not recognised
   */
  public static LoggingSetup plan(PrismConfig config, String level) {
    Level cliLevel = toLevel(level);
    Map<String, Object> structured = config.getMapping(Settings.LOG_CONFIG);
    if (structured.isEmpty()) {
      return new LoggingSetup(cliLevel, Map.of(), BASIC_PATTERN, false);
    }

    Level root = cliLevel;
    Object rawLevel = structured.get("level");
    if (rawLevel != null) {
      root = structuredLevel("level", rawLevel);
    }

    Map<String, Level> loggers = new LinkedHashMap<>();
    Object rawLoggers = structured.get("loggers");
    if (rawLoggers instanceof Map<?, ?> named) {
      for (Map.Entry<?, ?> entry : named.entrySet()) {
        String name = String.valueOf(entry.getKey());
        loggers.put(name, structuredLevel("loggers." + name, entry.getValue()));
      }
    } else if (rawLoggers != null) {
      throw new ConfigurationException("PRISM_LOG_CONFIG.loggers must be a mapping of logger name to level");
    }

    String datefmt = stringValue(structured.get("datefmt"), BASIC_DATE_FORMAT);
    String format = stringValue(structured.get("format"), null);
    String pattern = format == null
        ? "%d{" + datefmt + "} %logger:%level %msg%n"
        : withDateFormat(format, datefmt);
    return new LoggingSetup(root, loggers, pattern, true);
  }

  /**
   * Plans and applies logging to the running Logback context.
   *
   * @param config effective configuration
   * @param level root level name from the command line
   * @return the plan that was applied
   */
  public static LoggingSetup configure(PrismConfig config, String level) {
    LoggingSetup setup = plan(config, level);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      setup.apply(context);
      log.debug("Applied {} logging at {}", setup.structured() ? "structured" : "basic", setup.rootLevel());
    } else {
      log.warn("Logging setup requested but backend {} does not support dynamic configuration",
          factory.getClass().getName());
    }
    return setup;
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Maps a level name to a Logback level.
   *
   * @param name level name such as {@code debug}, {@code WARNING} or {@code critical}
   * @return Logback level
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  public static Level toLevel(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("log level must not be blank");
    }
    return switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "TRACE" -> Level.TRACE;
      case "DEBUG" -> Level.DEBUG;
      case "INFO" -> Level.INFO;
      case "WARN", "WARNING" -> Level.WARN;
      case "ERROR", "CRITICAL", "FATAL" -> Level.ERROR;
      case "OFF" -> Level.OFF;
      case "ALL", "NOTSET" -> Level.ALL;
      default -> throw new IllegalArgumentException("Unknown log level: " + name.trim());
    };
  }

  private static Level structuredLevel(String key, Object raw) {
    try {
      return toLevel(raw == null ? null : raw.toString());
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("PRISM_LOG_CONFIG." + key + ": " + ex.getMessage(), ex);
    }
  }

  private static String stringValue(Object raw, String fallback) {
    if (raw == null || raw.toString().isBlank()) {
      return fallback;
    }
    return raw.toString();
  }

  // A bare %d in a custom format picks up datefmt.
  private static String withDateFormat(String format, String datefmt) {
    return format.replaceAll("%d(?!\\{)", "%d{" + datefmt.replace("\\", "\\\\").replace("$", "\\$") + "}");
  }
}
