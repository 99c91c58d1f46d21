package ca.gc.cra.rigging.validation;

/**
 * Converts a raw setting value into its typed form.
 *
 * <p>Implementations are pure apart from the user and group validators, which consult the
 * system identity databases.</p>
 *
 * @param <T> typed value produced on success
 * @since 0.1.0
 */
@FunctionalInterface
public interface Validator<T> {

  /**
   * Validates and coerces {@code raw}.
   *
   * @param raw value from a CLI flag, configuration file, default or programmatic call; may be
   *     {@code null}
   * @return typed value
   * @throws ValidationException if {@code raw} cannot be coerced
   */
  T validate(Object raw);
}
