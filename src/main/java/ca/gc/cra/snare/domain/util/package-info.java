/**
 * Text helpers shared by domain types.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.domain.util;
