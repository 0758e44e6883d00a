package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.InferenceEngine;
import ca.siteguard.application.port.InferenceException;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.application.port.RawDetection;
import ca.siteguard.domain.backend.BackendFailure;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.hazard.HazardDetection;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.logging.Logs;
import ca.siteguard.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared adapter logic for backends that wrap an on-device {@link InferenceEngine}.
 * <p><strong>Why:</strong> Both on-device adapters need identical load checks, exception classification and label
 * mapping; only their tier, cost, coverage and confidence floor differ.</p>
 * <p><strong>Role:</strong> Infrastructure adapter base implementing {@link AnalyzerBackend}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the wrapped engine; the orchestrator serializes inference
 * through the local inference slot.</p>
 * <p><strong>Observability:</strong> Increments {@code analysis.backend.<id>.unmappedLabel} for labels the taxonomy
 * cannot resolve.</p>
 *
 * @since SiteGuard 0.1
 */
abstract class LocalEngineBackend implements AnalyzerBackend {
  private static final Logger log = LoggerFactory.getLogger(LocalEngineBackend.class);
  private static final int DETAIL_MAX_BYTES = 256;

  private final String id;
  private final InferenceEngine engine;
  private final DetectionMapper mapper;
  private final MetricsPort metrics;

  LocalEngineBackend(
      String id,
      InferenceEngine engine,
      HazardTaxonomy taxonomy,
      double minConfidence,
      MetricsPort metrics,
      ClockPort clock) {
    this.id = Strings.requireIdentifier("backend id", id);
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.mapper = new DetectionMapper(this.id, taxonomy, minConfidence, metrics, clock);
  }

  @Override
  public final String id() {
    return id;
  }

  @Override
  public final boolean available() {
    return engine.isLoaded();
  }

  @Override
  public final BackendOutcome analyze(AnalysisImage image, AnalysisContext context) {
    long startNanos = System.nanoTime();
    if (image.isEmpty()) {
      return failure(BackendFailureKind.MALFORMED_INPUT, "image payload is empty", startNanos);
    }
    if (!engine.isLoaded()) {
      return failure(BackendFailureKind.MODEL_NOT_LOADED, "model not loaded", startNanos);
    }
    List<RawDetection> raw;
    try {
      raw = engine.infer(image);
    } catch (InferenceException ex) {
      BackendFailureKind kind = switch (ex.reason()) {
        case MODEL_NOT_LOADED -> BackendFailureKind.MODEL_NOT_LOADED;
        case INVALID_INPUT -> BackendFailureKind.MALFORMED_INPUT;
        case RUNTIME -> BackendFailureKind.ENGINE_ERROR;
      };
      return failure(kind, ex.getMessage(), startNanos);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failure(BackendFailureKind.CANCELLED, "inference interrupted", startNanos);
    } catch (RuntimeException ex) {
      log.warn("Inference engine for {} failed unexpectedly", id, ex);
      return failure(BackendFailureKind.ENGINE_ERROR, ex.toString(), startNanos);
    }
    List<HazardDetection> detections = mapper.map(raw == null ? List.of() : raw, image);
    return BackendOutcome.success(id, tier(), detections, elapsedMillis(startNanos));
  }

  /**
   * Loads the engine's model.
   *
   * @return {@code true} when the model is loaded afterwards
   */
  @Override
  public final boolean reloadModel() {
    try {
      engine.load();
    } catch (InferenceException ex) {
      log.warn("Model reload for {} failed: {}", id, ex.getMessage());
      metrics.increment("analysis.backend." + id + ".loadFailure");
    }
    return engine.isLoaded();
  }

  private BackendOutcome failure(BackendFailureKind kind, String detail, long startNanos) {
    return BackendOutcome.failure(
        id, tier(), BackendFailure.of(kind, Logs.truncate(detail, DETAIL_MAX_BYTES)), elapsedMillis(startNanos));
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
