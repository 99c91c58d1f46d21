/**
 * Bundled worker types addressable by alias from the {@code worker_class} setting.
 */
package ca.gc.cra.rigging.workers;
