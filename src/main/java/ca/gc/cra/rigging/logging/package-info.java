/**
 * Logging setup driven by the logging settings.
 * <p><strong>Observability:</strong> SLF4J API with Logback as the runtime backend.</p>
 */
package ca.gc.cra.rigging.logging;
