package ca.gc.cra.rigging.api;

import ca.gc.cra.rigging.cli.CliOptionSpec;
import ca.gc.cra.rigging.cli.CliParserBuilder;
import ca.gc.cra.rigging.cli.CommandLineParser;
import ca.gc.cra.rigging.cli.HelpFormatter;
import ca.gc.cra.rigging.cli.ParsedArgs;
import ca.gc.cra.rigging.config.Configuration;
import ca.gc.cra.rigging.config.ConfigurationSnapshot;
import ca.gc.cra.rigging.config.SettingsMerger;
import ca.gc.cra.rigging.config.StandardSettings;
import ca.gc.cra.rigging.config.UnknownSettingException;
import ca.gc.cra.rigging.config.YamlSettingsLoader;
import ca.gc.cra.rigging.logging.LoggingConfigurator;
import ca.gc.cra.rigging.validation.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: builds the configuration from defaults, an optional configuration
 * file and command-line flags, then reports it.
 *
 * <p>Precedence is CLI &gt; configuration file &gt; declared default.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String USAGE = "rigging [OPTIONS] [APP_MODULE]";
  private static final String HELP = "--help";
  private static final String VERSION = "--version";
  private static final String PRINT_CONFIG = "--print-config";
  private static final String CHECK_CONFIG = "--check-config";
  private static final String END_OF_OPTIONS = "--";
  private static final Set<String> HELP_FLAGS = Set.of(HELP, "-h");
  private static final List<String[]> META_OPTIONS = List.of(
      new String[] {"-h, --help", "show this help message and exit"},
      new String[] {"--version", "show program's version number and exit"},
      new String[] {"--print-config", "print the effective configuration as JSON and exit"},
      new String[] {"--check-config", "validate the configuration and exit"});

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Builds and reports the configuration without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    Configuration configuration;
    try {
      configuration = Configuration.create(USAGE);
    } catch (RuntimeException ex) {
      log.error("Unable to initialize settings", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    List<CliOptionSpec> specs = CliParserBuilder.build(configuration);

    boolean help = false;
    boolean version = false;
    boolean printConfig = false;
    boolean checkConfig = false;
    List<String> remaining = new ArrayList<>();
    Set<String> valueFlags = specs.stream()
        .filter(CliOptionSpec::takesValue)
        .flatMap(spec -> spec.flags().stream())
        .collect(Collectors.toSet());
    String[] raw = args == null ? new String[0] : args;
    for (int i = 0; i < raw.length; i++) {
      String arg = raw[i];
      if (END_OF_OPTIONS.equals(arg)) {
        remaining.addAll(Arrays.asList(raw).subList(i, raw.length));
        break;
      }
      if (HELP_FLAGS.contains(arg)) {
        help = true;
      } else if (VERSION.equals(arg)) {
        version = true;
      } else if (PRINT_CONFIG.equals(arg)) {
        printConfig = true;
      } else if (CHECK_CONFIG.equals(arg)) {
        checkConfig = true;
      } else {
        remaining.add(arg);
        if (valueFlags.contains(arg) && i + 1 < raw.length) {
          remaining.add(raw[++i]);
        }
      }
    }

    if (help) {
      CliPrinter.println(HelpFormatter.format(configuration.usage(), Version.current(), specs,
          META_OPTIONS));
      return ExitCode.SUCCESS;
    }
    if (version) {
      CliPrinter.println("rigging (version " + Version.current() + ")");
      return ExitCode.SUCCESS;
    }

    ParsedArgs parsed;
    try {
      parsed = CommandLineParser.parse(specs, remaining.toArray(String[]::new));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println("usage: " + USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Map<String, Object> fileValues = loadConfigFile(parsed);
      SettingsMerger.apply(configuration, fileValues, parsed.values(), log::warn);
      if (configuration.logconfig() != null) {
        LoggingConfigurator.configureFrom(Path.of(configuration.logconfig()));
      }
      LoggingConfigurator.applyLevel(configuration.loglevel());
      if (configuration.debug()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      configuration.address();
    } catch (UnknownSettingException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (ValidationException ex) {
      log.error("Error: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (printConfig) {
      try {
        CliPrinter.println(toJson(ConfigurationSnapshot.of(configuration)));
      } catch (JsonProcessingException ex) {
        log.error("Unable to render configuration", ex);
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    }
    if (checkConfig) {
      log.info("Configuration OK");
      return ExitCode.SUCCESS;
    }

    String app = parsed.positionals().isEmpty() ? "<none>" : parsed.positionals().get(0);
    log.info("Configuration ready: app={} bind={} workers={} worker_class={} proc_name={}",
        app, configuration.address().toBindString(), configuration.workers(),
        configuration.get(StandardSettings.WORKER_CLASS), configuration.procName());
    return ExitCode.SUCCESS;
  }

  private static Map<String, Object> loadConfigFile(ParsedArgs parsed) throws IOException {
    Object configPath = parsed.values().get(StandardSettings.CONFIG);
    if (configPath == null || configPath.toString().isBlank()) {
      return Map.of();
    }
    Path path = Path.of(configPath.toString().strip());
    Optional<Map<String, Object>> values = YamlSettingsLoader.load(path);
    if (values.isEmpty()) {
      throw new IOException("configuration file not found: " + path);
    }
    log.debug("Loaded {} settings from {}", values.get().size(), path);
    return values.get();
  }

  static String toJson(ConfigurationSnapshot snapshot) throws JsonProcessingException {
    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    return mapper.writeValueAsString(snapshot.values());
  }
}
