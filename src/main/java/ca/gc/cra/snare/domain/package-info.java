/**
 * Core domain model for the SNARE capture → classify → persist pipeline.
 * <p><strong>Role:</strong> Protocol, attack, and alert value types free of infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable records and enums; safe to share across connection threads.</p>
 * <p><strong>Security:</strong> Payload-bearing types carry sanitized attacker text; consumers must still treat it
 * as untrusted.</p>
 */
package ca.gc.cra.snare.domain;
