package ca.gc.cra.midscan.application.port;

/**
 * Wall-clock source used to time identifier resolutions.
 *
 * @since 0.1.0
 * @see ca.gc.cra.midscan.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
