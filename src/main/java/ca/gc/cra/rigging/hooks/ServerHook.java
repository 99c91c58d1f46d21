package ca.gc.cra.rigging.hooks;

/**
 * Hook invoked with the arbiter only ({@code when_ready}, {@code pre_exec}).
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ServerHook extends Hook {

  /**
   * Runs the hook.
   *
   * @param server master process controller
   */
  void call(Arbiter server);

  @Override
  default int arity() {
    return 1;
  }
}
