package ca.siteguard.application.analysis;

import ca.siteguard.application.port.ConnectionQuality;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.HazardCategory;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time view of every backend, produced by
 * {@link SmartAnalysisOrchestrator#performHealthCheck()}.
 *
 * @param checkedAt time of the check
 * @param connectivity connectivity at check time
 * @param backends status per backend in registration order
 * @since SiteGuard 0.1
 */
public record HealthReport(Instant checkedAt, ConnectionQuality connectivity, List<BackendStatus> backends) {
  public HealthReport {
    Objects.requireNonNull(checkedAt, "checkedAt");
    Objects.requireNonNull(connectivity, "connectivity");
    backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
  }

  /**
   * Indicates whether a session started now could run at least one backend.
   *
   * @return {@code true} when some backend is available and reachable
   */
  public boolean anyUsable() {
    for (BackendStatus status : backends) {
      if (status.available() && (status.tier().local() || connectivity.connected())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Status of one backend.
   *
   * @param backendId backend id
   * @param tier backend tier
   * @param costClass cost class
   * @param capabilities hazard categories it detects
   * @param available result of the cheap availability check
   * @param successRate rolling success rate
   * @param averageLatencyMillis rolling average latency
   * @param sampleCount calls in the rolling window
   * @param deprioritized whether it is currently moved to the end of the chain
   * @param deprioritizedUntilMillis end of the deprioritization period; {@code 0} when not deprioritized
   */
  public record BackendStatus(
      String backendId,
      BackendTier tier,
      CostClass costClass,
      Set<HazardCategory> capabilities,
      boolean available,
      double successRate,
      long averageLatencyMillis,
      int sampleCount,
      boolean deprioritized,
      long deprioritizedUntilMillis) {
    public BackendStatus {
      Objects.requireNonNull(backendId, "backendId");
      Objects.requireNonNull(tier, "tier");
      Objects.requireNonNull(costClass, "costClass");
      capabilities = Set.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
    }
  }
}
