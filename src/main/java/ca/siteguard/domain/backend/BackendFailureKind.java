package ca.siteguard.domain.backend;

import ca.siteguard.domain.session.AnalysisErrorKind;

/**
 * <strong>What:</strong> Classified reasons a backend call can fail.
 * <p><strong>Why:</strong> The orchestrator applies different retry and fallback rules per reason; adapters map
 * engine and transport errors onto these kinds so raw exceptions never leave the adapter.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since SiteGuard 0.1
 */
public enum BackendFailureKind {
  /** Local model is not loaded; schedule a background reload, do not retry now. */
  MODEL_NOT_LOADED(AnalysisErrorKind.BACKEND_UNAVAILABLE, false),
  /** Call exceeded its deadline. */
  TIMEOUT(AnalysisErrorKind.BACKEND_TIMEOUT, true),
  /** Connection reset, DNS failure, 5xx and similar transport faults. */
  TRANSIENT_NETWORK(AnalysisErrorKind.BACKEND_UNAVAILABLE, true),
  /** Image cannot be decoded or was rejected as invalid; fatal for the session. */
  MALFORMED_INPUT(AnalysisErrorKind.MALFORMED_INPUT, false),
  /** Remote rejected the credentials. */
  REMOTE_UNAUTHORIZED(AnalysisErrorKind.BACKEND_UNAVAILABLE, false),
  /** Remote asked the client to slow down. */
  REMOTE_RATE_LIMITED(AnalysisErrorKind.BACKEND_RATE_LIMITED, false),
  /** Any other engine or decoding failure. */
  ENGINE_ERROR(AnalysisErrorKind.BACKEND_UNAVAILABLE, false),
  /** Call was abandoned because its session was cancelled; never counted in backend health. */
  CANCELLED(AnalysisErrorKind.CANCELLED, false);

  private final AnalysisErrorKind category;
  private final boolean retryable;

  BackendFailureKind(AnalysisErrorKind category, boolean retryable) {
    this.category = category;
    this.retryable = retryable;
  }

  /**
   * Maps the failure onto the session-level error taxonomy.
   *
   * @return session error kind
   */
  public AnalysisErrorKind category() {
    return category;
  }

  /**
   * Indicates whether a remote call failing this way is retried once with a shorter timeout.
   *
   * @return {@code true} for timeouts and transient network faults
   */
  public boolean retryable() {
    return retryable;
  }
}
