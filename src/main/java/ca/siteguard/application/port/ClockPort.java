package ca.siteguard.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the throttler, health registry and sessions.
 * <p><strong>Why:</strong> Throttle windows and deprioritization periods are time based; tests inject a
 * controllable clock instead of sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since SiteGuard 0.1
 * @see ca.siteguard.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
