/**
 * Lifecycle hook contracts and the runtime views handed to them.
 * <p><strong>Role:</strong> Each hook kind has one fixed functional signature so that a mismatched
 * hook is rejected by {@code Validators.callable(int)} when the configuration is built.</p>
 * <p><strong>Concurrency:</strong> Hooks are invoked by the server runtime; defaults are stateless.</p>
 */
package ca.gc.cra.rigging.hooks;
