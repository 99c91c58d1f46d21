package ca.gc.cra.rigging.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bridges the logging settings ({@code loglevel}, {@code logconfig},
 * {@code debug}) to the Logback backend.
 * <p><strong>Thread-safety:</strong> Intended for the single configuration-loading thread during
 * startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their
 * defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private static final Map<String, Level> LEVELS = Map.of(
      "debug", Level.DEBUG,
      "info", Level.INFO,
      "warning", Level.WARN,
      "warn", Level.WARN,
      "error", Level.ERROR,
      "critical", Level.ERROR);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG.
   */
  public static void enableVerboseLogging() {
    Logger root = rootLogger();
    if (root != null && !Level.DEBUG.equals(root.getLevel())) {
      root.setLevel(Level.DEBUG);
    }
  }

  /**
   * Sets the root level from a {@code loglevel} setting value.
   *
   * @param levelName one of {@code debug}, {@code info}, {@code warning}, {@code error},
   *     {@code critical} (case-insensitive)
   * @return the Logback level applied
   * @throws IllegalArgumentException if the name is not a known level
   */
  public static Level applyLevel(String levelName) {
    Level level = toLevel(levelName);
    Logger root = rootLogger();
    if (root != null) {
      root.setLevel(level);
    }
    return level;
  }

  /**
   * Maps a {@code loglevel} name to a Logback level.
   *
   * @param levelName level name
   * @return matching level
   * @throws IllegalArgumentException if the name is not a known level
   */
  public static Level toLevel(String levelName) {
    String key = levelName == null ? "" : levelName.strip().toLowerCase(Locale.ROOT);
    Level level = LEVELS.get(key);
    if (level == null) {
      throw new IllegalArgumentException("Invalid log level: " + levelName);
    }
    return level;
  }

  /**
   * Replaces the active Logback configuration with the XML file at {@code configFile}.
   *
   * @param configFile Logback configuration file named by {@code logconfig}
   * @throws IllegalArgumentException if the file cannot be applied
   */
  public static void configureFrom(Path configFile) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Log config {} ignored: backend {} is not Logback",
          configFile, factory.getClass().getName());
      return;
    }
    JoranConfigurator configurator = new JoranConfigurator();
    configurator.setContext(context);
    context.reset();
    try {
      configurator.doConfigure(configFile.toFile());
    } catch (JoranException ex) {
      throw new IllegalArgumentException("Failed to apply log config " + configFile, ex);
    }
  }

  private static Logger rootLogger() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return null;
  }
}
