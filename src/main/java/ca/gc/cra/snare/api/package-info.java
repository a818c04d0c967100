/**
 * Command-line entry points for SNARE.
 *
 * <p>{@link ca.gc.cra.snare.api.Main} dispatches to {@link ca.gc.cra.snare.api.ServeCli}, which merges CLI,
 * YAML, and built-in defaults into a {@link ca.gc.cra.snare.config.SnareConfig} before starting the decoys.</p>
 */
package ca.gc.cra.snare.api;
