package ca.gc.cra.rigging.hooks;

/**
 * Master process controller handed to server hooks. Implemented by the server runtime.
 *
 * @since 0.1.0
 */
public interface Arbiter {

  /**
   * Returns the process name the arbiter runs under.
   *
   * @return process name
   */
  String procName();
}
