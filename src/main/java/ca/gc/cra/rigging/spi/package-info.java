/**
 * Interfaces to collaborators outside the settings core: plugin type loading and the operating
 * system identity databases, with default implementations.
 */
package ca.gc.cra.rigging.spi;
