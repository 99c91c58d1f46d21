package ca.gc.cra.rigging.cli;

import ca.gc.cra.rigging.config.ActionKind;
import ca.gc.cra.rigging.config.ValueType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Command-line option generated from a setting declaration.
 *
 * @param flags flag strings, short forms first as declared
 * @param dest setting name the parsed value belongs to
 * @param metavar argument placeholder, {@code null} for flags without argument
 * @param action how the flag stores its value
 * @param type value type; empty unless {@code action} is {@link ActionKind#STORE}
 * @param help {@code "{shortDoc} [{default}]"}
 * @param section display section of the originating setting
 * @since 0.1.0
 */
public record CliOptionSpec(
    List<String> flags,
    String dest,
    String metavar,
    ActionKind action,
    Optional<ValueType> type,
    String help,
    String section) {

  /**
   * Copies the flag list and checks required fields.
   */
  public CliOptionSpec {
    flags = List.copyOf(flags);
    Objects.requireNonNull(dest, "dest");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Reports whether the option consumes an argument.
   *
   * @return {@code true} for {@link ActionKind#STORE}
   */
  public boolean takesValue() {
    return action == ActionKind.STORE;
  }
}
