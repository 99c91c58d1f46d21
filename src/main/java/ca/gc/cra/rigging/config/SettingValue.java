package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.validation.ValidationException;
import java.util.Objects;

/**
 * Live value of one setting inside one {@link Configuration}.
 *
 * <p>Not thread-safe; owned by a single configuration.</p>
 */
public final class SettingValue {
  private final Setting setting;
  private Object value;

  SettingValue(Setting setting) {
    this.setting = Objects.requireNonNull(setting, "setting");
  }

  /**
   * Returns the descriptor this cell belongs to.
   *
   * @return descriptor
   */
  public Setting setting() {
    return setting;
  }

  /**
   * Returns the current typed value.
   *
   * @return value, {@code null} when unset
   */
  public Object get() {
    return value;
  }

  /**
   * Validates {@code raw} and stores the result. The stored value is untouched on failure.
   *
   * @param raw raw input
   * @throws ValidationException naming the setting when validation fails
   */
  public void set(Object raw) {
    Object validated;
    try {
      validated = setting.validator().validate(raw);
    } catch (ValidationException ex) {
      throw ex.withSetting(setting.name());
    }
    this.value = validated;
  }
}
