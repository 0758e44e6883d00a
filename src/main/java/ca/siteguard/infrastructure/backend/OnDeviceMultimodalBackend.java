package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.InferenceEngine;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.util.EnumSet;
import java.util.Set;

/**
 * Backend over an on-device vision-language model. Covers every hazard category; available while the model is
 * loaded.
 *
 * @since SiteGuard 0.1
 */
public final class OnDeviceMultimodalBackend extends LocalEngineBackend {
  private static final Set<HazardCategory> CAPABILITIES =
      Set.copyOf(EnumSet.allOf(HazardCategory.class));

  /**
   * Creates the adapter.
   *
   * @param id backend id
   * @param engine on-device model runtime
   * @param taxonomy label alias source
   * @param metrics metrics sink
   * @param clock detection timestamp source
   */
  public OnDeviceMultimodalBackend(
      String id, InferenceEngine engine, HazardTaxonomy taxonomy, MetricsPort metrics, ClockPort clock) {
    super(id, engine, taxonomy, 0d, metrics, clock);
  }

  @Override
  public BackendTier tier() {
    return BackendTier.ON_DEVICE_MULTIMODAL;
  }

  @Override
  public CostClass costClass() {
    return CostClass.LOCAL_COMPUTE;
  }

  @Override
  public Set<HazardCategory> capabilities() {
    return CAPABILITIES;
  }
}
