package ca.siteguard.domain.backend;

/**
 * <strong>What:</strong> Capability tiers of analysis backends, in order of preference.
 * <p><strong>Why:</strong> Selection, fusion weights, timeouts and the degraded-capability flag are all decided
 * per tier rather than per concrete engine.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since SiteGuard 0.1
 */
public enum BackendTier {
  /** On-device vision-language model; private, offline, broad coverage. */
  ON_DEVICE_MULTIMODAL(1.0d, true, 3),
  /** Remote vision service; highest accuracy, needs connectivity, metered. */
  REMOTE_VISION(1.2d, false, 2),
  /** On-device lightweight object detector; always available, narrow coverage. */
  LOCAL_DETECTOR(0.7d, true, 1);

  private final double defaultWeight;
  private final boolean local;
  private final int capabilityRank;

  BackendTier(double defaultWeight, boolean local, int capabilityRank) {
    this.defaultWeight = defaultWeight;
    this.local = local;
    this.capabilityRank = capabilityRank;
  }

  /**
   * Returns the fusion reliability weight used when no override is configured.
   *
   * @return positive weight
   */
  public double defaultWeight() {
    return defaultWeight;
  }

  /**
   * Indicates whether the tier runs on the device and therefore needs the local inference slot.
   *
   * @return {@code true} for on-device tiers
   */
  public boolean local() {
    return local;
  }

  /**
   * Returns the detection capability rank; higher means broader coverage. The lightweight detector ranks
   * lowest, so a session served only by it is degraded.
   *
   * @return rank between 1 and 3
   */
  public int capabilityRank() {
    return capabilityRank;
  }
}
