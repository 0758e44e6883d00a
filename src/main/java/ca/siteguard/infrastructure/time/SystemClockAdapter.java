package ca.siteguard.infrastructure.time;

import ca.siteguard.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since SiteGuard 0.1
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()}; throttle windows and health cooldowns tolerate
   *     small wall-clock adjustments.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
