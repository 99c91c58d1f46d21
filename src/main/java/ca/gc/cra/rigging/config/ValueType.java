package ca.gc.cra.rigging.config;

/**
 * Type tag of a setting value as exposed to the CLI layer.
 *
 * @since 0.1.0
 */
public enum ValueType {
  STRING,
  INT,
  BOOL,
  CALLABLE
}
