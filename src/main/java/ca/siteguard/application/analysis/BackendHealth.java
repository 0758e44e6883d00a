package ca.siteguard.application.analysis;

import ca.siteguard.domain.backend.BackendFailureKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable snapshot of one backend's recent reliability.
 * <p><strong>Why:</strong> Snapshots are swapped atomically by {@link BackendHealthRegistry}; readers never observe
 * a half-applied update.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param backendId backend identifier
 * @param window most recent calls, oldest first
 * @param baselineSuccessRate rate reported while the window is empty (seeded from persistence), or {@code NaN}
 * @param lastFailureAtMillis epoch millis of the most recent failed call; {@code 0} when none
 * @param deprioritizedUntilMillis epoch millis until which the backend is deprioritized; {@code 0} when not
 * @since SiteGuard 0.1
 */
public record BackendHealth(
    String backendId,
    List<CallSample> window,
    double baselineSuccessRate,
    long lastFailureAtMillis,
    long deprioritizedUntilMillis) {

  public BackendHealth {
    Objects.requireNonNull(backendId, "backendId");
    window = List.copyOf(Objects.requireNonNull(window, "window"));
  }

  /**
   * Creates an empty snapshot with no history.
   *
   * @param backendId backend id
   * @return empty snapshot
   */
  public static BackendHealth empty(String backendId) {
    return new BackendHealth(backendId, List.of(), Double.NaN, 0L, 0L);
  }

  /**
   * Returns the rolling success rate.
   *
   * @return fraction of successful calls in the window; the baseline (or {@code 1.0}) when the window is empty
   */
  public double successRate() {
    if (window.isEmpty()) {
      return Double.isNaN(baselineSuccessRate) ? 1d : baselineSuccessRate;
    }
    int successes = 0;
    for (CallSample sample : window) {
      if (sample.success()) {
        successes++;
      }
    }
    return (double) successes / window.size();
  }

  /**
   * Returns the average latency of the calls in the window.
   *
   * @return mean latency in milliseconds; {@code 0} when the window is empty
   */
  public long averageLatencyMillis() {
    if (window.isEmpty()) {
      return 0L;
    }
    long total = 0L;
    for (CallSample sample : window) {
      total += sample.latencyMillis();
    }
    return total / window.size();
  }

  public int sampleCount() {
    return window.size();
  }

  /**
   * Indicates whether the backend should be moved to the end of the selection chain.
   *
   * @param nowMillis current time
   * @return {@code true} while the deprioritization period is running
   */
  public boolean isDeprioritized(long nowMillis) {
    return deprioritizedUntilMillis > nowMillis;
  }

  /**
   * Returns a new snapshot with the sample appended and deprioritization re-evaluated.
   *
   * @param sample completed call
   * @param settings window and threshold settings
   * @param nowMillis current time
   * @return updated snapshot
   */
  BackendHealth record(CallSample sample, HealthSettings settings, long nowMillis) {
    List<CallSample> next = new ArrayList<>(window.size() + 1);
    next.addAll(window);
    next.add(sample);
    while (next.size() > settings.windowSize()) {
      next.remove(0);
    }
    long lastFailure = sample.success() ? lastFailureAtMillis : nowMillis;
    BackendHealth candidate =
        new BackendHealth(backendId, next, baselineSuccessRate, lastFailure, deprioritizedUntilMillis);

    boolean rateLimited = sample.failureKind() == BackendFailureKind.REMOTE_RATE_LIMITED;
    boolean unreliable = next.size() >= settings.minimumSamples()
        && candidate.successRate() < settings.minSuccessRate();
    if (rateLimited || unreliable) {
      long until = Math.max(deprioritizedUntilMillis, nowMillis + settings.deprioritizeMillis());
      return new BackendHealth(backendId, next, baselineSuccessRate, lastFailure, until);
    }
    return candidate;
  }

  /**
   * One completed backend call.
   *
   * @param success whether the call produced detections
   * @param latencyMillis call duration
   * @param failureKind failure kind, or {@code null} on success
   */
  public record CallSample(boolean success, long latencyMillis, BackendFailureKind failureKind) {
    public CallSample {
      latencyMillis = Math.max(0L, latencyMillis);
      if (success && failureKind != null) {
        throw new IllegalArgumentException("successful sample must not carry a failure kind");
      }
    }
  }
}
