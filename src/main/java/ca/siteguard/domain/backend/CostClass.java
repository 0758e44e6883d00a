package ca.siteguard.domain.backend;

/**
 * Marginal cost of one backend call.
 *
 * @since SiteGuard 0.1
 */
public enum CostClass {
  /** Runs locally on cheap hardware paths. */
  LOCAL_FREE,
  /** Runs locally but uses significant compute and battery. */
  LOCAL_COMPUTE,
  /** Billed per request by a remote service. */
  REMOTE_METERED
}
