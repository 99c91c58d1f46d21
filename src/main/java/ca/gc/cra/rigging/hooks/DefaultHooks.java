package ca.gc.cra.rigging.hooks;

/**
 * Default implementations installed for every lifecycle hook setting.
 *
 * <p>All defaults do nothing except {@link #PRE_REQUEST}, which logs the request line at DEBUG on
 * the worker's logger.</p>
 *
 * @since 0.1.0
 */
public final class DefaultHooks {
  /** Default {@code when_ready}. */
  public static final ServerHook WHEN_READY = server -> { };
  /** Default {@code pre_fork}. */
  public static final WorkerHook PRE_FORK = (server, worker) -> { };
  /** Default {@code post_fork}. */
  public static final WorkerHook POST_FORK = (server, worker) -> { };
  /** Default {@code pre_exec}. */
  public static final ServerHook PRE_EXEC = server -> { };
  /** Default {@code pre_request}. */
  public static final RequestHook PRE_REQUEST =
      (worker, request) -> worker.log().debug("{} {}", request.method(), request.path());
  /** Default {@code post_request}. */
  public static final RequestHook POST_REQUEST = (worker, request) -> { };
  /** Default {@code worker_exit}. */
  public static final WorkerHook WORKER_EXIT = (server, worker) -> { };

  private DefaultHooks() {
    // Constants
  }
}
