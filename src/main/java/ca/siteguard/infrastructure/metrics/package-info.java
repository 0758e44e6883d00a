/**
 * OpenTelemetry bridge for the {@code MetricsPort}.
 * <p><strong>Metrics:</strong> Publishes under the {@code analysis.*} namespace. Only counts and latencies are
 * exported; image contents and detections never leave the process this way.</p>
 */
package ca.siteguard.infrastructure.metrics;
