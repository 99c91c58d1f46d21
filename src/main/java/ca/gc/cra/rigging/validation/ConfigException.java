package ca.gc.cra.rigging.validation;

/**
 * Raised when a user or group name cannot be resolved against the system databases.
 *
 * @since 0.1.0
 */
public class ConfigException extends ValidationException {
  private static final long serialVersionUID = 1L;

  private final String subject;

  /**
   * Creates a resolution failure.
   *
   * @param subject the user or group name that could not be resolved
   * @param reason message such as {@code No such user: 'www'}
   */
  public ConfigException(String subject, String reason) {
    this(null, subject, reason, null);
  }

  private ConfigException(String setting, String subject, String reason, Throwable cause) {
    super(setting, reason, cause);
    this.subject = subject;
  }

  /**
   * Returns the name that failed to resolve.
   *
   * @return offending user or group name
   */
  public String subject() {
    return subject;
  }

  @Override
  public ConfigException withSetting(String settingName) {
    return new ConfigException(settingName, subject, reason(), this);
  }
}
