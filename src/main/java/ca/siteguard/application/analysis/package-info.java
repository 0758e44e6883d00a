/**
 * Analysis use cases: the orchestrator, frame throttling, detection fusion, tag recommendation and backend
 * health tracking.
 * <p><strong>Role:</strong> Application layer; backends and persistence are reached through ports.</p>
 * <p><strong>Concurrency:</strong> The orchestrator runs sessions on its own pools. Fusion and recommendation
 * engines are stateless. Health is shared across sessions through atomic snapshot replacement.</p>
 * <p><strong>Metrics:</strong> Emits {@code analysis.session.*}, {@code analysis.backend.*},
 * {@code analysis.throttle.*}, {@code analysis.fusion.*} and {@code analysis.recommend.*}.</p>
 */
package ca.siteguard.application.analysis;
