package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.validation.Strings;
import ca.gc.cra.rigging.validation.Validator;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of one named, validated setting.
 *
 * <p>Descriptors are immutable. A freshly built descriptor has {@link #UNREGISTERED} as its order;
 * {@link SettingRegistry#register(Setting)} returns the registered copy with its position in the
 * catalog.</p>
 *
 * @param name unique setting identifier
 * @param section display group used to cluster CLI options
 * @param order registration index, or {@link #UNREGISTERED}
 * @param cliFlags CLI flags such as {@code -b} and {@code --bind}; empty when not exposed
 * @param metavar placeholder shown in help for the flag argument, may be {@code null}
 * @param action how the flag stores its value
 * @param type value type tag
 * @param validator coercion applied to defaults and every {@code set}
 * @param defaultValue raw default, {@code null} when absent
 * @param resolveAbsentDefault whether an absent default is still passed through the validator,
 *     used by settings whose absent value resolves to a process property
 * @param shortDoc first non-blank line of the documentation
 * @param longDoc full dedented documentation
 * @since 0.1.0
 */
public record Setting(
    String name,
    String section,
    int order,
    List<String> cliFlags,
    String metavar,
    ActionKind action,
    ValueType type,
    Validator<?> validator,
    Object defaultValue,
    boolean resolveAbsentDefault,
    String shortDoc,
    String longDoc) {

  /** Order carried by descriptors that have not been registered yet. */
  public static final int UNREGISTERED = -1;

  /**
   * Validates the descriptor's invariants.
   */
  public Setting {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("setting name must not be blank");
    }
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(validator, "validator for " + name);
    cliFlags = List.copyOf(cliFlags == null ? List.of() : cliFlags);
    for (String flag : cliFlags) {
      if (!Strings.requireNonBlank("flag of " + name, flag).startsWith("-")) {
        throw new IllegalArgumentException("CLI flag of " + name + " must start with '-': " + flag);
      }
    }
    shortDoc = shortDoc == null ? "" : shortDoc;
    longDoc = longDoc == null ? "" : longDoc;
  }

  /**
   * Starts a declaration.
   *
   * @param name unique setting name
   * @return builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Reports whether the setting has at least one CLI flag.
   *
   * @return {@code true} when exposed on the command line
   */
  public boolean hasCli() {
    return !cliFlags.isEmpty();
  }

  /**
   * Reports whether the declared default should be applied when the setting is instantiated.
   *
   * @return {@code true} when a default is present or an absent default resolves through the
   *     validator
   */
  public boolean appliesDefault() {
    return defaultValue != null || resolveAbsentDefault;
  }

  Setting withOrder(int assigned) {
    return new Setting(name, section, assigned, cliFlags, metavar, action, type, validator,
        defaultValue, resolveAbsentDefault, shortDoc, longDoc);
  }

  /**
   * Fluent builder for setting declarations.
   */
  public static final class Builder {
    private final String name;
    private String section = "";
    private List<String> cliFlags = List.of();
    private String metavar;
    private ActionKind action = ActionKind.STORE;
    private ValueType type = ValueType.STRING;
    private Validator<?> validator;
    private Object defaultValue;
    private boolean resolveAbsentDefault;
    private String desc = "";

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Sets the display section.
     *
     * @param value section label
     * @return this builder
     */
    public Builder section(String value) {
      this.section = value;
      return this;
    }

    /**
     * Sets the CLI flags.
     *
     * @param flags flag strings in display order
     * @return this builder
     */
    public Builder cli(String... flags) {
      this.cliFlags = Arrays.asList(flags);
      return this;
    }

    /**
     * Sets the help placeholder.
     *
     * @param value metavar such as {@code INT}
     * @return this builder
     */
    public Builder meta(String value) {
      this.metavar = value;
      return this;
    }

    /**
     * Sets the flag action.
     *
     * @param value action kind
     * @return this builder
     */
    public Builder action(ActionKind value) {
      this.action = value;
      return this;
    }

    /**
     * Sets the value type tag.
     *
     * @param value type tag
     * @return this builder
     */
    public Builder type(ValueType value) {
      this.type = value;
      return this;
    }

    /**
     * Sets the validator.
     *
     * @param value validator
     * @return this builder
     */
    public Builder validator(Validator<?> value) {
      this.validator = value;
      return this;
    }

    /**
     * Sets the raw default.
     *
     * @param value default, {@code null} when absent
     * @return this builder
     */
    public Builder defaultValue(Object value) {
      this.defaultValue = value;
      return this;
    }

    /**
     * Passes an absent default through the validator when the setting is instantiated.
     *
     * @return this builder
     */
    public Builder resolveAbsentDefault() {
      this.resolveAbsentDefault = true;
      return this;
    }

    /**
     * Sets the documentation. Indentation and surrounding blank lines are removed.
     *
     * @param value long-form documentation
     * @return this builder
     */
    public Builder desc(String value) {
      this.desc = value;
      return this;
    }

    /**
     * Builds the unregistered descriptor.
     *
     * @return descriptor with order {@link #UNREGISTERED}
     */
    public Setting build() {
      String longDoc = Docs.normalize(desc);
      return new Setting(name, section, UNREGISTERED, cliFlags, metavar, action, type, validator,
          defaultValue, resolveAbsentDefault, Docs.shortForm(longDoc), longDoc);
    }
  }
}
