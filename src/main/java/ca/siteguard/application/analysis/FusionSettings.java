package ca.siteguard.application.analysis;

import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.validation.Numbers;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables for {@link ResultFusionEngine}.
 *
 * @param iouThreshold minimum intersection-over-union for two detections of one type to be the same hazard
 * @param tierWeights reliability weight per tier; missing tiers use {@link BackendTier#defaultWeight()}
 * @param backendWeights reliability weight overrides per backend id; take precedence over tier weights
 * @param agreementBoost multiplier increment per extra agreeing backend
 * @since SiteGuard 0.1
 */
public record FusionSettings(
    double iouThreshold,
    Map<BackendTier, Double> tierWeights,
    Map<String, Double> backendWeights,
    double agreementBoost) {
  public static final double DEFAULT_IOU_THRESHOLD = 0.3d;
  public static final double DEFAULT_AGREEMENT_BOOST = 0.1d;

  public FusionSettings {
    if (!Double.isFinite(iouThreshold) || iouThreshold <= 0d || iouThreshold > 1d) {
      throw new IllegalArgumentException("iouThreshold must be within (0, 1] (was " + iouThreshold + ")");
    }
    Objects.requireNonNull(tierWeights, "tierWeights");
    Map<BackendTier, Double> tiers = new EnumMap<>(BackendTier.class);
    tierWeights.forEach((tier, weight) -> tiers.put(
        Objects.requireNonNull(tier, "tier"), Numbers.requirePositive("weight." + tier, weight)));
    tierWeights = Map.copyOf(tiers);
    Objects.requireNonNull(backendWeights, "backendWeights");
    backendWeights.forEach((id, weight) -> Numbers.requirePositive("weight." + id, weight));
    backendWeights = Map.copyOf(backendWeights);
    Numbers.requireRange("agreementBoost", agreementBoost, 0d, 1d);
  }

  /**
   * Returns the default settings: IoU 0.3, tier default weights, boost 0.1.
   *
   * @return default settings
   */
  public static FusionSettings defaults() {
    return new FusionSettings(DEFAULT_IOU_THRESHOLD, Map.of(), Map.of(), DEFAULT_AGREEMENT_BOOST);
  }

  /**
   * Resolves the weight applied to a backend's detections.
   *
   * @param backendId backend id
   * @param tier backend tier
   * @return configured weight
   */
  public double weightFor(String backendId, BackendTier tier) {
    Double byId = backendWeights.get(backendId);
    if (byId != null) {
      return byId;
    }
    return tierWeights.getOrDefault(tier, tier.defaultWeight());
  }
}
