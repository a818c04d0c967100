/**
 * Clock adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.time;
