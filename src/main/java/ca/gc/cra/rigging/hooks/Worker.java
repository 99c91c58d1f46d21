package ca.gc.cra.rigging.hooks;

import org.slf4j.Logger;

/**
 * Worker process handed to worker and request hooks. Implemented by the server runtime.
 *
 * @since 0.1.0
 */
public interface Worker {

  /**
   * Returns the worker's operating system process id.
   *
   * @return process id
   */
  long pid();

  /**
   * Returns the logger the worker writes to.
   *
   * @return worker logger
   */
  Logger log();
}
