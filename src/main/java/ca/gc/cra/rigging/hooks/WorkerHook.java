package ca.gc.cra.rigging.hooks;

/**
 * Hook invoked around worker lifecycle events ({@code pre_fork}, {@code post_fork},
 * {@code worker_exit}).
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface WorkerHook extends Hook {

  /**
   * Runs the hook.
   *
   * @param server master process controller
   * @param worker worker being forked or that just exited
   */
  void call(Arbiter server, Worker worker);

  @Override
  default int arity() {
    return 2;
  }
}
