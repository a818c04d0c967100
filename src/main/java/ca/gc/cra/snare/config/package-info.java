/**
 * Configuration loading (defaults, YAML, CLI) and the composition root that wires adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.config;
