/**
 * Command-line entry point that builds, validates and reports the server configuration.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, loads the
 * configuration file, configures logging, and maps failures to exit codes.</p>
 */
package ca.gc.cra.rigging.api;
