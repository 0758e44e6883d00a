package ca.siteguard.domain.hazard;

import ca.siteguard.validation.Numbers;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> One backend's raw report of a potential hazard.
 * <p><strong>Why:</strong> Gives fusion a uniform input regardless of which engine produced the observation.</p>
 * <p><strong>Role:</strong> Domain value object created by backend adapters and discarded after fusion.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param type detected hazard type
 * @param confidence engine confidence in {@code [0, 1]}
 * @param region location within the frame
 * @param backendId identifier of the backend that produced the detection
 * @param detectedAt instant the adapter produced the detection
 * @since SiteGuard 0.1
 */
public record HazardDetection(
    HazardType type,
    double confidence,
    BoundingRegion region,
    String backendId,
    Instant detectedAt) {

  /**
   * Validates references and the confidence range.
   *
   * @throws NullPointerException if any reference is {@code null}
   * @throws IllegalArgumentException if {@code confidence} is outside {@code [0, 1]}
   */
  public HazardDetection {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(backendId, "backendId");
    Objects.requireNonNull(detectedAt, "detectedAt");
    Numbers.requireUnitInterval("confidence", confidence);
  }
}
