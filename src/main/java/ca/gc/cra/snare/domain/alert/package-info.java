/**
 * Alert value types raised as side effects of qualifying attack events.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.domain.alert;
