package ca.gc.cra.snare.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for captured attacks and alerts.
 * <p><strong>Why:</strong> Tests inject fixed clocks so stored timestamps are deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every connection worker reads the
 * clock.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.snare.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
