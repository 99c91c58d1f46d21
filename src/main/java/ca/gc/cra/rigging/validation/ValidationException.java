package ca.gc.cra.rigging.validation;

/**
 * Raised when a raw setting value cannot be coerced into its typed form.
 *
 * <p>Validators throw it without knowing which setting they serve; the configuration layer
 * attaches the setting name through {@link #withSetting(String)} before surfacing it to callers.</p>
 *
 * @since 0.1.0
 */
public class ValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String setting;
  private final String reason;

  /**
   * Creates a failure that is not yet bound to a setting.
   *
   * @param reason human-readable reason for the rejection
   */
  public ValidationException(String reason) {
    this(null, reason, null);
  }

  /**
   * Creates a failure that is not yet bound to a setting.
   *
   * @param reason human-readable reason for the rejection
   * @param cause underlying parse failure
   */
  public ValidationException(String reason, Throwable cause) {
    this(null, reason, cause);
  }

  /**
   * Creates a failure bound to a setting.
   *
   * @param setting setting name, or {@code null} when unknown
   * @param reason human-readable reason for the rejection
   * @param cause underlying failure, may be {@code null}
   */
  public ValidationException(String setting, String reason, Throwable cause) {
    super(setting == null ? reason : "Invalid value for setting '" + setting + "': " + reason, cause);
    this.setting = setting;
    this.reason = reason;
  }

  /**
   * Returns the setting the failure belongs to.
   *
   * @return setting name or {@code null} when the validator ran standalone
   */
  public String setting() {
    return setting;
  }

  /**
   * Returns the reason without the setting prefix.
   *
   * @return reason text
   */
  public String reason() {
    return reason;
  }

  /**
   * Returns a copy of this failure naming {@code settingName}.
   *
   * @param settingName setting whose validator rejected the value
   * @return new exception carrying the same reason and this exception as cause
   */
  public ValidationException withSetting(String settingName) {
    return new ValidationException(settingName, reason, this);
  }
}
