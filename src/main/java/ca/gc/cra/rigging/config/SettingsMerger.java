package ca.gc.cra.rigging.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Applies configuration-file and command-line values onto a {@link Configuration}.
 *
 * <p>Declared defaults are already in place when the configuration is built; file values are
 * applied next and command-line values last, so precedence is CLI &gt; file &gt; default. Only
 * values that were explicitly supplied are applied.</p>
 */
public final class SettingsMerger {

  private SettingsMerger() {}

  /**
   * Applies {@code file} then {@code cli} through {@link Configuration#set(String, Object)}.
   *
   * @param configuration target configuration
   * @param file values read from a configuration file, may be empty
   * @param cli values explicitly present on the command line, may be empty
   * @param warn consumer invoked when a CLI value overrides a file value
   * @throws UnknownSettingException if a key is not a registered setting
   * @throws ca.gc.cra.rigging.validation.ValidationException if a value is rejected
   */
  public static void apply(
      Configuration configuration,
      Map<String, ?> file,
      Map<String, ?> cli,
      Consumer<String> warn) {
    Objects.requireNonNull(configuration, "configuration");
    Map<String, ?> fileValues = file == null ? Map.of() : file;
    Map<String, ?> cliValues = cli == null ? Map.of() : cli;

    for (Map.Entry<String, ?> entry : fileValues.entrySet()) {
      configuration.set(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, ?> entry : cliValues.entrySet()) {
      if (fileValues.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides config file for setting: " + entry.getKey());
      }
      configuration.set(entry.getKey(), entry.getValue());
    }
  }
}
