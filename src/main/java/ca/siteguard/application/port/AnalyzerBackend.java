package ca.siteguard.application.port;

import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import java.util.Set;

/**
 * <strong>What:</strong> Uniform contract over one hazard analysis engine.
 * <p><strong>Why:</strong> The orchestrator selects among heterogeneous engines by tier, cost, capability and
 * availability metadata; it never needs to know which engine sits behind an id.</p>
 * <p><strong>Role:</strong> Application port implemented by infrastructure adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert every engine or transport error into a classified failure; never throw from {@link #analyze}.</li>
 *   <li>Map engine labels to hazard types and normalize regions.</li>
 *   <li>Honour thread interruption as cancellation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls. Local adapters are
 * additionally serialized by the orchestrator's inference slot.</p>
 *
 * @since SiteGuard 0.1
 */
public interface AnalyzerBackend {
  /**
   * Returns the stable backend id used in logs, metrics, weights and health records.
   *
   * @return identifier matching {@code [A-Za-z0-9._-]+}
   */
  String id();

  BackendTier tier();

  CostClass costClass();

  /**
   * Returns the hazard categories this backend can detect.
   *
   * @return non-empty immutable set
   */
  Set<HazardCategory> capabilities();

  /**
   * Cheap availability check; must not perform I/O or inference.
   *
   * @return {@code true} when a call is expected to be able to run
   */
  boolean available();

  /**
   * Analyzes an image.
   *
   * @param image image to analyze
   * @param context request hints
   * @return detections or a classified failure; never {@code null}
   */
  BackendOutcome analyze(AnalysisImage image, AnalysisContext context);

  /**
   * Attempts to (re)load the backend's model. Invoked off the session path after a model-not-loaded failure.
   *
   * @return {@code true} when the backend is available afterwards
   */
  default boolean reloadModel() {
    return available();
  }
}
