package ca.siteguard.application.port;

/**
 * <strong>What:</strong> Port abstracting SiteGuard metrics emission.
 * <p><strong>Why:</strong> Lets the analysis engines record counters and latency observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from session and backend
 * threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code analysis.session.latencyMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since SiteGuard 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code analysis.throttle.dropped})
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming
   * @param value observed value (e.g., milliseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
