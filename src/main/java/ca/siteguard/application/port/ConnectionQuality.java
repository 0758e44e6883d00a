package ca.siteguard.application.port;

/**
 * Coarse network quality reported by the connectivity collaborator.
 *
 * @since SiteGuard 0.1
 */
public enum ConnectionQuality {
  OFFLINE,
  POOR,
  FAIR,
  GOOD,
  EXCELLENT;

  public boolean connected() {
    return this != OFFLINE;
  }

  /**
   * Indicates whether the link is good enough to add a remote call alongside a local one.
   *
   * @return {@code true} for FAIR and better
   */
  public boolean supportsHybrid() {
    return compareTo(FAIR) >= 0;
  }
}
