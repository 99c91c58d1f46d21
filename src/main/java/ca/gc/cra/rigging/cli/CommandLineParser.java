package ca.gc.cra.rigging.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses command-line arguments against generated {@link CliOptionSpec}s.
 *
 * <p>Supports {@code -x VALUE}, {@code -xVALUE}, {@code --long VALUE}, {@code --long=VALUE} and
 * argument-less flags, which store {@code true}. {@code --} ends option parsing. Only options that appear are
 * reported, so declared defaults stay in effect for everything else.</p>
 *
 * @since 0.1.0
 */
public final class CommandLineParser {
  private static final String END_OF_OPTIONS = "--";

  private CommandLineParser() {}

  /**
   * Parses {@code args}.
   *
   * @param specs option specifications
   * @param args raw arguments; {@code null} is treated as empty
   * @return explicit option values and positional arguments
   * @throws IllegalArgumentException on unknown options, missing arguments, or values given to
   *     flags that take none
   */
  public static ParsedArgs parse(List<CliOptionSpec> specs, String[] args) {
    Objects.requireNonNull(specs, "specs");
    Map<String, CliOptionSpec> byFlag = new HashMap<>();
    for (CliOptionSpec spec : specs) {
      for (String flag : spec.flags()) {
        byFlag.put(flag, spec);
      }
    }

    Map<String, Object> values = new LinkedHashMap<>();
    List<String> positionals = new ArrayList<>();
    if (args == null) {
      return new ParsedArgs(values, positionals);
    }

    boolean optionsEnded = false;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null) {
        continue;
      }
      if (optionsEnded || !arg.startsWith("-") || arg.equals("-")) {
        positionals.add(arg);
        continue;
      }
      if (arg.equals(END_OF_OPTIONS)) {
        optionsEnded = true;
        continue;
      }

      String flag = arg;
      String inlineValue = null;
      int eq = arg.indexOf('=');
      if (arg.startsWith("--") && eq > 0) {
        flag = arg.substring(0, eq);
        inlineValue = arg.substring(eq + 1);
      } else if (isAttachedShortValue(arg, byFlag)) {
        flag = arg.substring(0, 2);
        inlineValue = arg.substring(2);
      }
      CliOptionSpec spec = byFlag.get(flag);
      if (spec == null) {
        throw new IllegalArgumentException("no such option: " + flag);
      }

      if (!spec.takesValue()) {
        if (inlineValue != null) {
          throw new IllegalArgumentException(flag + " option does not take a value");
        }
        values.put(spec.dest(), Boolean.TRUE);
        continue;
      }
      if (inlineValue == null) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException(flag + " option requires an argument");
        }
        inlineValue = args[++i];
      }
      values.put(spec.dest(), inlineValue);
    }
    return new ParsedArgs(values, positionals);
  }

  /**
   * Reports whether {@code arg} is a short flag that takes a value with the value attached, as in
   * {@code -w4}.
   *
   * @param arg raw argument
   * @param byFlag options keyed by flag
   * @return {@code true} when the first two characters name a value-taking short option
   */
  static boolean isAttachedShortValue(String arg, Map<String, CliOptionSpec> byFlag) {
    if (arg.startsWith("--") || arg.length() <= 2 || byFlag.containsKey(arg)) {
      return false;
    }
    CliOptionSpec spec = byFlag.get(arg.substring(0, 2));
    return spec != null && spec.takesValue();
  }
}
