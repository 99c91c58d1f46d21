package ca.gc.cra.rigging.hooks;

/**
 * Hook invoked by a worker around request processing ({@code pre_request},
 * {@code post_request}).
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RequestHook extends Hook {

  /**
   * Runs the hook.
   *
   * @param worker worker handling the request
   * @param request request being processed
   */
  void call(Worker worker, Request request);

  @Override
  default int arity() {
    return 2;
  }
}
