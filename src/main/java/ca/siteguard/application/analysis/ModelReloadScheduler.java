package ca.siteguard.application.analysis;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.MetricsPort;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link AnalyzerBackend#reloadModel()} in the background after a model-not-loaded failure.
 *
 * <p>Requests for a backend that already has a reload pending are coalesced into the pending one.</p>
 *
 * @since SiteGuard 0.1
 */
final class ModelReloadScheduler {
  private static final Logger log = LoggerFactory.getLogger(ModelReloadScheduler.class);

  private final ExecutorService executor;
  private final MetricsPort metrics;
  private final Set<String> pending = ConcurrentHashMap.newKeySet();

  ModelReloadScheduler(ExecutorService executor, MetricsPort metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Schedules a reload unless one is already pending for the backend.
   *
   * @param backend backend whose model failed to load
   * @return {@code true} when a new reload was scheduled
   */
  boolean schedule(AnalyzerBackend backend) {
    String id = backend.id();
    if (!pending.add(id)) {
      log.debug("Model reload already pending for {}", id);
      return false;
    }
    try {
      executor.execute(() -> reload(backend));
      return true;
    } catch (RejectedExecutionException ex) {
      pending.remove(id);
      log.warn("Could not schedule model reload for {}: executor rejected task", id);
      return false;
    }
  }

  boolean isPending(String backendId) {
    return pending.contains(backendId);
  }

  private void reload(AnalyzerBackend backend) {
    String id = backend.id();
    try {
      boolean ok = backend.reloadModel();
      if (ok) {
        log.info("Model reloaded for backend {}", id);
        metrics.increment("analysis.backend." + id + ".reload.success");
      } else {
        log.warn("Model reload for backend {} did not make it available", id);
        metrics.increment("analysis.backend." + id + ".reload.failure");
      }
    } catch (RuntimeException ex) {
      log.warn("Model reload for backend {} failed", id, ex);
      metrics.increment("analysis.backend." + id + ".reload.failure");
    } finally {
      pending.remove(id);
    }
  }
}
