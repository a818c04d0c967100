package ca.gc.cra.snare.domain.alert;

/**
 * Reason an alert was raised.
 *
 * @since 0.1.0
 */
public enum AlertType {
  /** The payload contained a denylisted shell or network-tool keyword. */
  DANGEROUS_COMMAND,
  /** The event was classified HIGH or CRITICAL. */
  HIGH_THREAT
}
