/**
 * Threat classification over cumulative, process-wide attack history.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.analysis;
