package ca.siteguard.domain.hazard;

import ca.siteguard.validation.Numbers;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A hazard believed to be one physical condition, merged from one or more detections.
 * <p><strong>Why:</strong> Gives recommendation and reporting a single ranked view independent of backend count.</p>
 * <p><strong>Role:</strong> Domain value object produced by fusion; lives as long as its session.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the backend list is copied.</p>
 *
 * @param type hazard type shared by every merged detection
 * @param confidence aggregate confidence in {@code [0, 1]} computed by the fusion rule
 * @param severity severity from the taxonomy
 * @param region representative region (from the strongest contributing detection)
 * @param contributingBackends sorted ids of the backends that reported this hazard
 * @param detectionCount number of raw detections merged, including per-backend duplicates
 * @since SiteGuard 0.1
 */
public record FusedHazard(
    HazardType type,
    double confidence,
    Severity severity,
    BoundingRegion region,
    List<String> contributingBackends,
    int detectionCount) {

  /**
   * Validates fields and copies the backend list.
   *
   * @throws IllegalArgumentException if the confidence is out of range or no backend contributed
   */
  public FusedHazard {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(region, "region");
    Numbers.requireUnitInterval("confidence", confidence);
    contributingBackends = List.copyOf(Objects.requireNonNull(contributingBackends, "contributingBackends"));
    if (contributingBackends.isEmpty()) {
      throw new IllegalArgumentException("fused hazard requires at least one contributing backend");
    }
    if (detectionCount < contributingBackends.size()) {
      throw new IllegalArgumentException("detectionCount must cover every contributing backend");
    }
  }

  /**
   * Indicates whether more than one backend confirmed the hazard.
   *
   * @return {@code true} when two or more backends contributed
   */
  public boolean crossConfirmed() {
    return contributingBackends.size() > 1;
  }
}
