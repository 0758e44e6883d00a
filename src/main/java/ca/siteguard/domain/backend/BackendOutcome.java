package ca.siteguard.domain.backend;

import ca.siteguard.domain.hazard.HazardDetection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Result of one backend call: either a detection list or a classified failure.
 * <p><strong>Why:</strong> Failures travel as values so the orchestrator can apply policy without catching
 * engine-specific exceptions.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param backendId backend that produced the outcome
 * @param tier backend tier
 * @param detections detections; empty on failure and on a clear result
 * @param failure failure, or {@code null} on success
 * @param latencyMillis wall-clock duration of the call
 * @since SiteGuard 0.1
 */
public record BackendOutcome(
    String backendId,
    BackendTier tier,
    List<HazardDetection> detections,
    BackendFailure failure,
    long latencyMillis) {

  public BackendOutcome {
    Objects.requireNonNull(backendId, "backendId");
    Objects.requireNonNull(tier, "tier");
    detections = List.copyOf(Objects.requireNonNull(detections, "detections"));
    if (failure != null && !detections.isEmpty()) {
      throw new IllegalArgumentException("failed outcome must not carry detections");
    }
    latencyMillis = Math.max(0L, latencyMillis);
  }

  /**
   * Creates a successful outcome.
   *
   * @param backendId backend id
   * @param tier backend tier
   * @param detections detections; may be empty
   * @param latencyMillis call duration
   * @return success outcome
   */
  public static BackendOutcome success(
      String backendId, BackendTier tier, List<HazardDetection> detections, long latencyMillis) {
    return new BackendOutcome(backendId, tier, detections, null, latencyMillis);
  }

  /**
   * Creates a failed outcome.
   *
   * @param backendId backend id
   * @param tier backend tier
   * @param failure classified failure
   * @param latencyMillis call duration
   * @return failure outcome
   */
  public static BackendOutcome failure(
      String backendId, BackendTier tier, BackendFailure failure, long latencyMillis) {
    return new BackendOutcome(
        backendId, tier, List.of(), Objects.requireNonNull(failure, "failure"), latencyMillis);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public Optional<BackendFailure> failureIfAny() {
    return Optional.ofNullable(failure);
  }

  /**
   * Returns the failure kind, or {@code null} on success.
   *
   * @return failure kind or {@code null}
   */
  public BackendFailureKind failureKind() {
    return failure == null ? null : failure.kind();
  }
}
