package ca.gc.cra.rigging.hooks;

/**
 * Request view handed to request hooks. Implemented by the server runtime.
 *
 * @since 0.1.0
 */
public interface Request {

  /**
   * Returns the request method, for example {@code GET}.
   *
   * @return request method
   */
  String method();

  /**
   * Returns the request path without the query string.
   *
   * @return request path
   */
  String path();
}
