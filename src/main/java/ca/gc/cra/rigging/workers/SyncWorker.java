package ca.gc.cra.rigging.workers;

import ca.gc.cra.rigging.hooks.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default worker type, selected by the {@code sync} alias of {@code worker_class}.
 *
 * <p>Handles one request at a time. Request handling itself lives in the server; this type is the
 * handle the hooks receive.</p>
 *
 * @since 0.1.0
 */
public final class SyncWorker implements Worker {
  private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

  private final long pid;

  /**
   * Creates a handle for the worker running as {@code pid}.
   *
   * @param pid worker process id
   */
  public SyncWorker(long pid) {
    this.pid = pid;
  }

  @Override
  public long pid() {
    return pid;
  }

  @Override
  public Logger log() {
    return log;
  }
}
