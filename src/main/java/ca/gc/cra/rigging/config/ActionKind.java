package ca.gc.cra.rigging.config;

/**
 * How a CLI flag stores its value.
 *
 * @since 0.1.0
 */
public enum ActionKind {
  /** The flag takes an argument that is stored as the setting value. */
  STORE,
  /** The flag takes no argument; its presence stores {@code true}. */
  STORE_TRUE
}
