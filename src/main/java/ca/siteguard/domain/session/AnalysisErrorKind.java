package ca.siteguard.domain.session;

/**
 * <strong>What:</strong> Session-level error categories.
 * <p>Only {@link #MALFORMED_INPUT}, {@link #NO_BACKEND_AVAILABLE} and {@link #CANCELLED} end a session; the others
 * are absorbed through retry and fallback and surface only in logs, metrics and the degraded flag.</p>
 *
 * @since SiteGuard 0.1
 */
public enum AnalysisErrorKind {
  /** Backend could not run; the next backend in the chain is tried. */
  BACKEND_UNAVAILABLE(false),
  /** Backend exceeded its deadline; remote calls are retried once. */
  BACKEND_TIMEOUT(false),
  /** Remote backend throttled the client; it is deprioritized. */
  BACKEND_RATE_LIMITED(false),
  /** Image cannot be analyzed by any backend. */
  MALFORMED_INPUT(true),
  /** No backend produced a result. */
  NO_BACKEND_AVAILABLE(true),
  /** One of the hybrid backends failed; fusion used the other. */
  PARTIAL_FUSION_FAILURE(false),
  /** The session was cancelled by its owner or preempted by a photo. */
  CANCELLED(true);

  private final boolean surfaced;

  AnalysisErrorKind(boolean surfaced) {
    this.surfaced = surfaced;
  }

  /**
   * Indicates whether this kind is reported to the caller as a session failure.
   *
   * @return {@code true} when the kind terminates the session
   */
  public boolean surfaced() {
    return surfaced;
  }
}
