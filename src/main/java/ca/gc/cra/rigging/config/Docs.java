package ca.gc.cra.rigging.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalizes setting documentation.
 *
 * <p>Long-form text loses the indentation common to its non-blank lines and is then trimmed; its
 * first non-blank line is the short form used in CLI help.</p>
 */
final class Docs {
  private Docs() {}

  static String normalize(String desc) {
    if (desc == null) {
      return "";
    }
    List<String> lines = desc.lines().toList();
    int indent = lines.stream()
        .filter(line -> !line.isBlank())
        .mapToInt(Docs::leadingWhitespace)
        .min()
        .orElse(0);
    return lines.stream()
        .map(line -> line.isBlank() ? "" : line.substring(indent).stripTrailing())
        .collect(Collectors.joining("\n"))
        .strip();
  }

  static String shortForm(String normalized) {
    return normalized.lines()
        .filter(line -> !line.isBlank())
        .findFirst()
        .map(String::strip)
        .orElse("");
  }

  private static int leadingWhitespace(String line) {
    int count = 0;
    while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
      count++;
    }
    return count;
  }
}
