package ca.gc.cra.rigging.cli;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link CommandLineParser#parse(List, String[])}.
 *
 * @param values values of options explicitly present, keyed by setting name in encounter order
 * @param positionals remaining non-option arguments
 * @since 0.1.0
 */
public record ParsedArgs(Map<String, Object> values, List<String> positionals) {

  /**
   * Copies both collections.
   */
  public ParsedArgs {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    positionals = List.copyOf(positionals);
  }
}
