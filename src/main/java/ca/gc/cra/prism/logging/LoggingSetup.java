package ca.gc.cra.prism.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Resolved logging plan: root level, per-logger levels and the console line pattern.
 * <p><strong>Why:</strong> Separates deciding how logging should look from mutating the Logback context, so
 * the decision can be inspected in tests and applied to any {@link LoggerContext}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #apply(LoggerContext)} must run during single-threaded
 * startup.</p>
 *
 * @param rootLevel level for the root logger
 * @param loggerLevels levels for named loggers, applied after the root level
 * @param pattern Logback pattern used by the console appender
 * @param structured {@code true} when built from a {@code PRISM_LOG_CONFIG} mapping
 * @since 0.1.0
 */
public record LoggingSetup(
    Level rootLevel, Map<String, Level> loggerLevels, String pattern, boolean structured) {

  static final String CONSOLE_APPENDER = "PRISM_CONSOLE";

  public LoggingSetup {
    Objects.requireNonNull(rootLevel, "rootLevel");
    loggerLevels = Map.copyOf(Objects.requireNonNull(loggerLevels, "loggerLevels"));
    Objects.requireNonNull(pattern, "pattern");
  }

  /**
   * Replaces the root console output of {@code context} with this plan.
   *
   * @param context Logback context to reconfigure
   */
  public void apply(LoggerContext context) {
    Objects.requireNonNull(context, "context");
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(pattern);
    encoder.start();

    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setContext(context);
    console.setName(CONSOLE_APPENDER);
    console.setEncoder(encoder);
    console.start();

    root.detachAndStopAllAppenders();
    root.addAppender(console);
    root.setLevel(rootLevel);
    loggerLevels.forEach((name, level) -> context.getLogger(name).setLevel(level));
  }
}
