package ca.siteguard.application.analysis;

import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.session.SessionFailure;
import ca.siteguard.domain.session.SessionState;
import ca.siteguard.domain.session.SubmissionKind;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable builder for one session, confined to the session thread.
 *
 * <p>Enforces forward-only transitions and refuses changes once a terminal state is reached.</p>
 */
final class SessionTracker {
  private final String correlationId;
  private final SubmissionKind kind;
  private final Instant startedAt;
  private final long startedAtMillis;
  private final List<SessionState> history = new ArrayList<>();
  private final List<String> backendChain = new ArrayList<>();
  private final List<String> contributors = new ArrayList<>();
  private final Set<HazardCategory> covered = EnumSet.noneOf(HazardCategory.class);
  private List<FusedHazard> fused = List.of();
  private TagRecommendations recommendations = TagRecommendations.EMPTY;
  private boolean degraded;
  private SessionFailure failure;
  private AnalysisSession finalized;

  SessionTracker(String correlationId, SubmissionKind kind, long nowMillis) {
    this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.startedAtMillis = nowMillis;
    this.startedAt = Instant.ofEpochMilli(nowMillis);
    history.add(SessionState.IDLE);
  }

  SessionState state() {
    return history.get(history.size() - 1);
  }

  void transition(SessionState next) {
    SessionState current = state();
    if (!current.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal session transition " + current + " -> " + next + " for " + correlationId);
    }
    history.add(next);
  }

  void attempted(String backendId) {
    requireOpen();
    if (!backendChain.contains(backendId)) {
      backendChain.add(backendId);
    }
  }

  void contributed(String backendId, Set<HazardCategory> capabilities) {
    requireOpen();
    if (!contributors.contains(backendId)) {
      contributors.add(backendId);
    }
    covered.addAll(capabilities);
  }

  void fused(List<FusedHazard> hazards) {
    requireOpen();
    this.fused = List.copyOf(hazards);
  }

  void recommended(TagRecommendations result) {
    requireOpen();
    this.recommendations = Objects.requireNonNull(result, "result");
  }

  void degraded(boolean value) {
    requireOpen();
    this.degraded = value;
  }

  AnalysisSession complete(long nowMillis) {
    transition(SessionState.COMPLETE);
    return build(nowMillis);
  }

  AnalysisSession fail(SessionFailure cause, long nowMillis) {
    transition(SessionState.FAILED);
    this.failure = Objects.requireNonNull(cause, "cause");
    this.fused = List.of();
    this.recommendations = TagRecommendations.EMPTY;
    this.degraded = false;
    return build(nowMillis);
  }

  String correlationId() {
    return correlationId;
  }

  private AnalysisSession build(long nowMillis) {
    finalized = new AnalysisSession(
        correlationId,
        kind,
        fused,
        recommendations.recommendations(),
        recommendations.autoSelectTags(),
        degraded,
        backendChain,
        contributors,
        covered,
        startedAt,
        Math.max(0L, nowMillis - startedAtMillis),
        history,
        failure);
    return finalized;
  }

  private void requireOpen() {
    if (finalized != null || state().isTerminal()) {
      throw new IllegalStateException("session " + correlationId + " is already finalized");
    }
  }
}
