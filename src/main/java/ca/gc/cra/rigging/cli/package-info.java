/**
 * Command-line surface generated from setting declarations: option specifications, a parser for
 * them, and help rendering.
 */
package ca.gc.cra.rigging.cli;
