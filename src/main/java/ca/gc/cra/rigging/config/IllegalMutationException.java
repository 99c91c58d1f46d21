package ca.gc.cra.rigging.config;

/**
 * Raised when a registered setting is assigned as a plain attribute instead of through
 * {@link Configuration#set(String, Object)}.
 *
 * @since 0.1.0
 */
public class IllegalMutationException extends UnsupportedOperationException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param setting the setting that was assigned directly
   */
  public IllegalMutationException(String setting) {
    super("Invalid access: setting '" + setting + "' must be changed with set()");
  }
}
