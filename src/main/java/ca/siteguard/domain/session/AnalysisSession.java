package ca.siteguard.domain.session;

import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.tag.TagRecommendation;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Finalized result of analyzing one image.
 * <p><strong>Why:</strong> The tag-editing UI and the report generator consume one consistent snapshot, whether
 * the analysis succeeded, degraded or failed.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by the orchestrator once the session reaches a terminal
 * state.</p>
 * <p><strong>Thread-safety:</strong> Immutable; every collection is copied.</p>
 *
 * @param correlationId id tying logs, metrics and the result together
 * @param submissionKind photo or frame
 * @param fusedHazards fused hazards, best first
 * @param recommendations tag recommendations, auto-selected first
 * @param autoSelectTags ids of auto-selected tags, in recommendation order
 * @param degradedCapability {@code true} when only lightweight detectors contributed results
 * @param backendChain backends attempted, in order
 * @param contributingBackends backends whose detections reached fusion
 * @param coveredCategories hazard categories the contributing backends can detect
 * @param startedAt session start
 * @param latencyMillis total session latency
 * @param stateHistory every state visited, starting at {@link SessionState#IDLE}
 * @param failure failure when the session ended {@link SessionState#FAILED}, otherwise {@code null}
 * @since SiteGuard 0.1
 */
public record AnalysisSession(
    String correlationId,
    SubmissionKind submissionKind,
    List<FusedHazard> fusedHazards,
    List<TagRecommendation> recommendations,
    Set<String> autoSelectTags,
    boolean degradedCapability,
    List<String> backendChain,
    List<String> contributingBackends,
    Set<HazardCategory> coveredCategories,
    Instant startedAt,
    long latencyMillis,
    List<SessionState> stateHistory,
    SessionFailure failure) {

  /**
   * Validates that the session is terminal and consistent with its failure.
   *
   * @throws IllegalArgumentException when the history does not end in a terminal state or the failure
   *     contradicts the terminal state
   */
  public AnalysisSession {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(submissionKind, "submissionKind");
    fusedHazards = List.copyOf(Objects.requireNonNull(fusedHazards, "fusedHazards"));
    recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
    autoSelectTags = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(autoSelectTags, "autoSelectTags")));
    backendChain = List.copyOf(Objects.requireNonNull(backendChain, "backendChain"));
    contributingBackends = List.copyOf(Objects.requireNonNull(contributingBackends, "contributingBackends"));
    Objects.requireNonNull(coveredCategories, "coveredCategories");
    coveredCategories = coveredCategories.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(HazardCategory.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(coveredCategories));
    Objects.requireNonNull(startedAt, "startedAt");
    stateHistory = List.copyOf(Objects.requireNonNull(stateHistory, "stateHistory"));
    if (stateHistory.isEmpty() || !stateHistory.get(stateHistory.size() - 1).isTerminal()) {
      throw new IllegalArgumentException("session must end in a terminal state: " + stateHistory);
    }
    SessionState terminal = stateHistory.get(stateHistory.size() - 1);
    if ((terminal == SessionState.FAILED) != (failure != null)) {
      throw new IllegalArgumentException("failure must be present exactly when the session FAILED");
    }
  }

  /**
   * Returns the terminal state.
   *
   * @return {@link SessionState#COMPLETE} or {@link SessionState#FAILED}
   */
  public SessionState state() {
    return stateHistory.get(stateHistory.size() - 1);
  }

  public boolean isComplete() {
    return state() == SessionState.COMPLETE;
  }

  public Optional<SessionFailure> failureIfAny() {
    return Optional.ofNullable(failure);
  }
}
