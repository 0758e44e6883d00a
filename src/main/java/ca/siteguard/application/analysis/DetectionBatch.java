package ca.siteguard.application.analysis;

import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.hazard.HazardDetection;
import java.util.List;
import java.util.Objects;

/**
 * Detections produced by one successful backend call, as fed to fusion.
 *
 * @param backendId backend identifier
 * @param tier backend tier, used to pick the default weight
 * @param detections detections; may be empty
 * @since SiteGuard 0.1
 */
public record DetectionBatch(String backendId, BackendTier tier, List<HazardDetection> detections) {
  public DetectionBatch {
    Objects.requireNonNull(backendId, "backendId");
    Objects.requireNonNull(tier, "tier");
    detections = List.copyOf(Objects.requireNonNull(detections, "detections"));
  }

  /**
   * Converts a successful outcome into a batch.
   *
   * @param outcome successful backend outcome
   * @return batch carrying the outcome's detections
   * @throws IllegalArgumentException if the outcome is a failure
   */
  public static DetectionBatch from(BackendOutcome outcome) {
    if (!outcome.isSuccess()) {
      throw new IllegalArgumentException("cannot fuse failed outcome from " + outcome.backendId());
    }
    return new DetectionBatch(outcome.backendId(), outcome.tier(), outcome.detections());
  }
}
