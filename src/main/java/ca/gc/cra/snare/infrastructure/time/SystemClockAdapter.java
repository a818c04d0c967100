package ca.gc.cra.snare.infrastructure.time;

import ca.gc.cra.snare.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
