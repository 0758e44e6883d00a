package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.InferenceEngine;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.util.Set;

/**
 * Backend over a small on-device object detector. Only PPE, equipment and housekeeping hazards are in reach;
 * detections under the confidence floor are dropped.
 *
 * @since SiteGuard 0.1
 */
public final class LightweightDetectorBackend extends LocalEngineBackend {
  /** Default raw confidence floor. */
  public static final double DEFAULT_MIN_CONFIDENCE = 0.25d;

  private static final Set<HazardCategory> CAPABILITIES =
      Set.of(HazardCategory.PPE, HazardCategory.EQUIPMENT, HazardCategory.HOUSEKEEPING);

  public LightweightDetectorBackend(
      String id, InferenceEngine engine, HazardTaxonomy taxonomy, MetricsPort metrics, ClockPort clock) {
    this(id, engine, taxonomy, DEFAULT_MIN_CONFIDENCE, metrics, clock);
  }

  /**
   * Creates the adapter with an explicit confidence floor.
   *
   * @param id backend id
   * @param engine detector runtime
   * @param taxonomy label alias source
   * @param minConfidence detections below this confidence are dropped
   * @param metrics metrics sink
   * @param clock detection timestamp source
   */
  public LightweightDetectorBackend(
      String id,
      InferenceEngine engine,
      HazardTaxonomy taxonomy,
      double minConfidence,
      MetricsPort metrics,
      ClockPort clock) {
    super(id, engine, taxonomy, minConfidence, metrics, clock);
  }

  @Override
  public BackendTier tier() {
    return BackendTier.LOCAL_DETECTOR;
  }

  @Override
  public CostClass costClass() {
    return CostClass.LOCAL_FREE;
  }

  @Override
  public Set<HazardCategory> capabilities() {
    return CAPABILITIES;
  }
}
