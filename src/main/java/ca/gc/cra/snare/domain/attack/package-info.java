/**
 * Attack value types: the protocol and type tags set by handlers, the analyzer's verdict, and the persisted
 * {@link ca.gc.cra.snare.domain.attack.AttackEvent}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.domain.attack;
