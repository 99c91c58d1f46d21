package ca.gc.cra.rigging.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalLevel);
  }

  @Test
  void mapsLevelNames() {
    assertEquals(Level.DEBUG, LoggingConfigurator.toLevel("debug"));
    assertEquals(Level.INFO, LoggingConfigurator.toLevel(" INFO "));
    assertEquals(Level.WARN, LoggingConfigurator.toLevel("warning"));
    assertEquals(Level.ERROR, LoggingConfigurator.toLevel("error"));
    assertEquals(Level.ERROR, LoggingConfigurator.toLevel("critical"));
  }

  @Test
  void rejectsUnknownLevel() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.toLevel("loud"));
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.toLevel(null));
  }

  @Test
  void appliesLevelToRootLogger() {
    Level applied = LoggingConfigurator.applyLevel("error");

    assertEquals(Level.ERROR, applied);
    assertEquals(Level.ERROR, root.getLevel());
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    root.setLevel(Level.WARN);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void appliesExternalConfigFile() throws Exception {
    Path config = tempDir.resolve("logback.xml");
    Files.writeString(config, """
        <configuration>
          <root level="ERROR"/>
        </configuration>
        """);

    try {
      LoggingConfigurator.configureFrom(config);
      assertEquals(Level.ERROR, root.getLevel());
    } finally {
      reloadTestConfig();
    }
  }

  @Test
  void brokenConfigFileIsRejected() throws Exception {
    Path config = tempDir.resolve("broken.xml");
    Files.writeString(config, "<configuration><root");

    try {
      assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.configureFrom(config));
    } finally {
      reloadTestConfig();
    }
  }

  private static void reloadTestConfig() throws Exception {
    Path testConfig = Path.of(LoggingConfiguratorTest.class.getResource("/logback-test.xml").toURI());
    LoggingConfigurator.configureFrom(testConfig);
  }
}
