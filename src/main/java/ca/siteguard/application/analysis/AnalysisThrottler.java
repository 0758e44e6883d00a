package ca.siteguard.application.analysis;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.session.SubmissionKind;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Caps the rate at which streaming frames enter analysis.
 * <p><strong>Why:</strong> A preview renders at display rate while analysis only needs a few frames per second;
 * dropping (never queueing) keeps analysis on the most recent frame.</p>
 * <p><strong>Role:</strong> Gate in front of the orchestrator's frame entry point. Photos bypass it.</p>
 * <p><strong>Thread-safety:</strong> Lock-free. Acceptance is a compare-and-set on the last accepted timestamp, so
 * concurrent submitters get exactly one acceptance per window.</p>
 * <p><strong>Observability:</strong> Increments {@code analysis.throttle.accepted} and
 * {@code analysis.throttle.dropped}.</p>
 *
 * @since SiteGuard 0.1
 */
public final class AnalysisThrottler {
  /** Default minimum spacing between accepted frames: 2 Hz. */
  public static final long DEFAULT_MIN_INTERVAL_MILLIS = 500L;

  private static final long NEVER = Long.MIN_VALUE;

  private final long minIntervalMillis;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AtomicLong lastAcceptedMillis = new AtomicLong(NEVER);

  /**
   * Creates a throttler.
   *
   * @param minIntervalMillis minimum spacing between accepted frames; must be non-negative
   * @param clock time source
   * @param metrics metrics sink
   */
  public AnalysisThrottler(long minIntervalMillis, ClockPort clock, MetricsPort metrics) {
    if (minIntervalMillis < 0L) {
      throw new IllegalArgumentException("minIntervalMillis must be >= 0");
    }
    this.minIntervalMillis = minIntervalMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decides whether a submission may proceed to analysis.
   *
   * <p>Photos are always accepted and leave the throttle window untouched.</p>
   *
   * @param kind submission kind
   * @return {@code true} when the submission should be analyzed
   */
  public boolean tryAccept(SubmissionKind kind) {
    Objects.requireNonNull(kind, "kind");
    if (kind == SubmissionKind.PHOTO) {
      return true;
    }
    long now = clock.nowMillis();
    while (true) {
      long last = lastAcceptedMillis.get();
      if (last != NEVER && now - last < minIntervalMillis) {
        metrics.increment("analysis.throttle.dropped");
        return false;
      }
      if (lastAcceptedMillis.compareAndSet(last, now)) {
        metrics.increment("analysis.throttle.accepted");
        return true;
      }
    }
  }

  /**
   * Returns how long until the next frame would be accepted; useful for UI hints.
   *
   * @return milliseconds to wait, {@code 0} when a frame would be accepted now
   */
  public long millisUntilNextFrame() {
    long last = lastAcceptedMillis.get();
    if (last == NEVER) {
      return 0L;
    }
    long remaining = minIntervalMillis - (clock.nowMillis() - last);
    return Math.max(0L, remaining);
  }

  public long minIntervalMillis() {
    return minIntervalMillis;
  }
}
