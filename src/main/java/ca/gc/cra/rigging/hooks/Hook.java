package ca.gc.cra.rigging.hooks;

/**
 * Base type of every server lifecycle hook.
 *
 * <p>Each hook kind is a functional sub-interface with one fixed signature; {@link #arity()}
 * reports how many arguments that signature takes so that a hook registered for the wrong
 * lifecycle point is rejected while the configuration is validated.</p>
 *
 * @since 0.1.0
 * @see ServerHook
 * @see WorkerHook
 * @see RequestHook
 */
public interface Hook {

  /**
   * Returns the number of arguments the hook's callback accepts.
   *
   * @return parameter count of the hook signature
   */
  int arity();
}
