package ca.gc.cra.rigging.config;

/**
 * Raised when a setting name is not registered in a configuration.
 *
 * @since 0.1.0
 */
public class UnknownSettingException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String setting;

  /**
   * Creates the exception.
   *
   * @param setting the unknown name
   */
  public UnknownSettingException(String setting) {
    super("No configuration setting for: " + setting);
    this.setting = setting;
  }

  /**
   * Returns the unknown name.
   *
   * @return setting name
   */
  public String setting() {
    return setting;
  }
}
