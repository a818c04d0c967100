/**
 * Alert policy evaluated after each attack is persisted.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.alert;
