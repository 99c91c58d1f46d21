package ca.gc.cra.rigging.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rigging.config.ConfigurationSnapshot;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MainTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Logger root;
  private Level rootLevel;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    rootLevel = root.getLevel();
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    root.setLevel(rootLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsGeneratedOptions() {
    ExitCode code = Main.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    String help = buffer.toString();
    assertTrue(help.contains("Usage: rigging [OPTIONS] [APP_MODULE]"));
    assertTrue(help.contains("-b, --bind ADDRESS"));
    assertTrue(help.contains("The socket to bind. [127.0.0.1:8000]"));
    assertTrue(help.contains("--print-config"));
  }

  @Test
  void helpFlagAsOptionValueIsNotHelp() {
    ExitCode code = Main.run(new String[] {"-n", "--help", "--check-config"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().isEmpty());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Configuration OK")));
  }

  @Test
  void helpFlagAfterDoubleDashIsPositional() {
    ExitCode code = Main.run(new String[] {"--", "--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().isEmpty());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage()
            .startsWith("Configuration ready: app=--help ")));
  }

  @Test
  void versionIsPrinted() {
    ExitCode code = Main.run(new String[] {"--version"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("rigging (version "));
  }

  @Test
  void negativeWorkersAreRejected() {
    ExitCode code = Main.run(new String[] {"-w", "-1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("workers")));
  }

  @Test
  void unknownOptionPrintsUsage() {
    ExitCode code = Main.run(new String[] {"--wrokers", "2"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: rigging"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("no such option: --wrokers")));
  }

  @Test
  void configFileIsMergedBelowCommandLine() throws Exception {
    Path file = tempDir.resolve("server.yaml");
    Files.writeString(file, """
        workers: 3
        bind: 0.0.0.0:9000
        proc_name: billing
        """);

    ExitCode code = Main.run(new String[] {
        "-c", file.toString(), "-w", "5", "--log-level", "warning", "--print-config"});

    assertEquals(ExitCode.SUCCESS, code);
    String json = buffer.toString();
    assertTrue(json.contains("\"workers\" : 5"), json);
    assertTrue(json.contains("\"bind\" : \"0.0.0.0:9000\""), json);
    assertTrue(json.contains("\"proc_name\" : \"billing\""), json);
    assertTrue(json.contains("\"pre_request\" : \"<RequestHook>\""), json);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage()
            .equals("CLI overrides config file for setting: workers")));
  }

  @Test
  void unknownKeyInConfigFileIsConfigError() throws Exception {
    Path file = tempDir.resolve("typo.yaml");
    Files.writeString(file, "wrokers: 3\n");

    ExitCode code = Main.run(new String[] {"-c", file.toString(), "--check-config"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("wrokers")));
  }

  @Test
  void missingConfigFileIsIoError() {
    ExitCode code = Main.run(new String[] {"-c", tempDir.resolve("absent.yaml").toString()});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void invalidLogLevelIsConfigError() {
    ExitCode code = Main.run(new String[] {"--log-level", "loud", "--check-config"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void malformedBindIsInvalidArgs() {
    ExitCode code = Main.run(new String[] {"-b", "localhost:http", "--check-config"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void checkConfigReportsSuccess() {
    ExitCode code = Main.run(new String[] {"--check-config", "-b", "unix:/tmp/app.sock"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Configuration OK")));
  }

  @Test
  void startupSummaryNamesApplication() {
    ExitCode code = Main.run(new String[] {"-n", "shop", "-w", "0x4", "shop.wsgi:app"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals(
            "Configuration ready: app=shop.wsgi:app bind=127.0.0.1:8000 workers=4"
                + " worker_class=sync proc_name=shop")));
  }

  @Test
  void snapshotRendersAsOrderedJson() throws Exception {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("bind", "127.0.0.1:8000");
    values.put("pidfile", null);

    String json = Main.toJson(new ConfigurationSnapshot(values));

    assertTrue(json.indexOf("\"bind\"") < json.indexOf("\"pidfile\""));
    assertTrue(json.contains("\"pidfile\" : null"));
  }
}
