package ca.siteguard.application.analysis;

import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.validation.Numbers;

/**
 * Timeouts, retry and concurrency tunables for {@link SmartAnalysisOrchestrator}.
 *
 * @param localTimeoutMillis deadline for one on-device call
 * @param remoteTimeoutMillis deadline for one remote call
 * @param retryTimeoutFactor multiplier applied to the remote deadline for the single retry
 * @param remoteMaxConcurrent maximum remote calls in flight across all sessions
 * @param hybridEnabled run local and remote backends together for every session when connectivity allows
 * @param batchConcurrency default number of sessions in flight for batch analysis
 * @since SiteGuard 0.1
 */
public record OrchestratorSettings(
    long localTimeoutMillis,
    long remoteTimeoutMillis,
    double retryTimeoutFactor,
    int remoteMaxConcurrent,
    boolean hybridEnabled,
    int batchConcurrency) {
  public static final long DEFAULT_LOCAL_TIMEOUT_MILLIS = 2_000L;
  public static final long DEFAULT_REMOTE_TIMEOUT_MILLIS = 10_000L;
  public static final double DEFAULT_RETRY_TIMEOUT_FACTOR = 0.5d;
  public static final int DEFAULT_REMOTE_MAX_CONCURRENT = 3;
  public static final int DEFAULT_BATCH_CONCURRENCY = 3;

  public OrchestratorSettings {
    Numbers.requireRange("timeout.localMillis", localTimeoutMillis, 1L, 600_000L);
    Numbers.requireRange("timeout.remoteMillis", remoteTimeoutMillis, 1L, 600_000L);
    if (!Double.isFinite(retryTimeoutFactor) || retryTimeoutFactor <= 0d || retryTimeoutFactor > 1d) {
      throw new IllegalArgumentException(
          "retry.timeoutFactor must be within (0, 1] (was " + retryTimeoutFactor + ")");
    }
    Numbers.requireRange("remote.maxConcurrent", remoteMaxConcurrent, 1, 64);
    Numbers.requireRange("batch.maxConcurrency", batchConcurrency, 1, 64);
  }

  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(
        DEFAULT_LOCAL_TIMEOUT_MILLIS,
        DEFAULT_REMOTE_TIMEOUT_MILLIS,
        DEFAULT_RETRY_TIMEOUT_FACTOR,
        DEFAULT_REMOTE_MAX_CONCURRENT,
        false,
        DEFAULT_BATCH_CONCURRENCY);
  }

  /**
   * Returns the first-attempt deadline for a tier.
   *
   * @param tier backend tier
   * @return timeout in milliseconds
   */
  public long timeoutFor(BackendTier tier) {
    return tier.local() ? localTimeoutMillis : remoteTimeoutMillis;
  }

  /**
   * Returns the shortened deadline used for the single remote retry.
   *
   * @param tier backend tier
   * @return timeout in milliseconds, at least 1
   */
  public long retryTimeoutFor(BackendTier tier) {
    return Math.max(1L, Math.round(timeoutFor(tier) * retryTimeoutFactor));
  }
}
