package ca.gc.cra.rigging.cli;

import java.util.List;
import java.util.Objects;

/**
 * Renders CLI help grouped by section, keeping the order produced by {@link CliParserBuilder}.
 *
 * @since 0.1.0
 */
public final class HelpFormatter {
  private static final int HELP_COLUMN = 32;

  private HelpFormatter() {}

  /**
   * Formats help text.
   *
   * @param usage usage line, may be {@code null}
   * @param version version string appended to the header, may be {@code null}
   * @param specs options in display order
   * @param extraOptions additional {@code flag, description} pairs listed under "Options"
   * @return multi-line help text without trailing newline
   */
  public static String format(
      String usage, String version, List<CliOptionSpec> specs, List<String[]> extraOptions) {
    Objects.requireNonNull(specs, "specs");
    StringBuilder out = new StringBuilder();
    if (usage != null && !usage.isBlank()) {
      out.append("Usage: ").append(usage.strip()).append('\n');
    }
    if (version != null && !version.isBlank()) {
      out.append("Version: ").append(version).append('\n');
    }

    if (extraOptions != null && !extraOptions.isEmpty()) {
      out.append('\n').append("Options:").append('\n');
      for (String[] option : extraOptions) {
        appendRow(out, option[0], option[1]);
      }
    }

    String currentSection = null;
    for (CliOptionSpec spec : specs) {
      if (!Objects.equals(currentSection, spec.section())) {
        currentSection = spec.section();
        out.append('\n').append(currentSection).append(':').append('\n');
      }
      String flags = String.join(", ", spec.flags());
      if (spec.metavar() != null) {
        flags = flags + ' ' + spec.metavar();
      }
      appendRow(out, flags, spec.help());
    }
    return out.toString().stripTrailing();
  }

  private static void appendRow(StringBuilder out, String left, String right) {
    out.append("  ").append(left);
    int width = left.length() + 2;
    if (width >= HELP_COLUMN) {
      out.append('\n');
      width = 0;
    }
    out.append(" ".repeat(HELP_COLUMN - width)).append(right).append('\n');
  }
}
