package ca.gc.cra.rigging.config;

/**
 * Raised when a setting is registered under a name that is already taken.
 *
 * @since 0.1.0
 */
public class DuplicateSettingException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String setting;

  /**
   * Creates the exception.
   *
   * @param setting colliding setting name
   */
  public DuplicateSettingException(String setting) {
    super("Duplicate setting: " + setting);
    this.setting = setting;
  }

  /**
   * Returns the colliding name.
   *
   * @return setting name
   */
  public String setting() {
    return setting;
  }
}
