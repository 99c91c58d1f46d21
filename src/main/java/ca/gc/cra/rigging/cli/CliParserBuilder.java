package ca.gc.cra.rigging.cli;

import ca.gc.cra.rigging.config.ActionKind;
import ca.gc.cra.rigging.config.Configuration;
import ca.gc.cra.rigging.config.Setting;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the command-line surface from a {@link Configuration}.
 *
 * <p>Options are sorted by section label and then by registration order, so help output is stable
 * whatever order the settings are iterated in. The builder only describes options; applying parsed
 * values is left to {@link CommandLineParser} and
 * {@link ca.gc.cra.rigging.config.SettingsMerger}.</p>
 *
 * @since 0.1.0
 */
public final class CliParserBuilder {
  static final String ABSENT_DEFAULT = "none";

  private static final Comparator<Setting> DISPLAY_ORDER =
      Comparator.comparing(Setting::section).thenComparingInt(Setting::order);

  private CliParserBuilder() {}

  /**
   * Builds the option specifications for every setting that declares at least one flag.
   *
   * @param configuration configuration whose settings are exposed
   * @return options in {@code (section, order)} order
   */
  public static List<CliOptionSpec> build(Configuration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    return configuration.descriptors().stream()
        .filter(Setting::hasCli)
        .sorted(DISPLAY_ORDER)
        .map(CliParserBuilder::toSpec)
        .toList();
  }

  static CliOptionSpec toSpec(Setting setting) {
    boolean store = setting.action() == ActionKind.STORE;
    return new CliOptionSpec(
        setting.cliFlags(),
        setting.name(),
        setting.metavar(),
        setting.action(),
        store ? Optional.of(setting.type()) : Optional.empty(),
        setting.shortDoc() + " [" + renderDefault(setting.defaultValue()) + "]",
        setting.section());
  }

  private static String renderDefault(Object value) {
    return value == null ? ABSENT_DEFAULT : String.valueOf(value);
  }
}
