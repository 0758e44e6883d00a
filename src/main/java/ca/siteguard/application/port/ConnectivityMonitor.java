package ca.siteguard.application.port;

/**
 * Port onto the device's network monitor. Checked once at the start of every session.
 *
 * @since SiteGuard 0.1
 */
public interface ConnectivityMonitor {
  /**
   * Returns the current connection quality.
   *
   * @return quality; never {@code null}
   */
  ConnectionQuality quality();

  default boolean isConnected() {
    return quality().connected();
  }

  /** Monitor that always reports {@link ConnectionQuality#OFFLINE}. */
  ConnectivityMonitor OFFLINE = () -> ConnectionQuality.OFFLINE;

  /** Monitor that always reports {@link ConnectionQuality#GOOD}. */
  ConnectivityMonitor ALWAYS_ONLINE = () -> ConnectionQuality.GOOD;
}
