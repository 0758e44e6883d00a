package ca.siteguard.application.analysis;

import ca.siteguard.validation.Numbers;

/**
 * Thresholds for {@link TagRecommendationEngine}.
 *
 * @param autoSelectThreshold minimum confidence for a tag to be pre-selected
 * @param displayThreshold minimum confidence for a tag to be shown at all
 * @since SiteGuard 0.1
 */
public record RecommendationSettings(double autoSelectThreshold, double displayThreshold) {
  public static final double DEFAULT_AUTO_SELECT_THRESHOLD = 0.80d;
  public static final double DEFAULT_DISPLAY_THRESHOLD = 0.40d;

  /**
   * Validates both thresholds.
   *
   * @throws IllegalArgumentException when a threshold is outside {@code [0, 1]} or the display threshold
   *     exceeds the auto-select threshold
   */
  public RecommendationSettings {
    Numbers.requireUnitInterval("autoSelectThreshold", autoSelectThreshold);
    Numbers.requireUnitInterval("displayThreshold", displayThreshold);
    if (displayThreshold > autoSelectThreshold) {
      throw new IllegalArgumentException("displayThreshold (" + displayThreshold
          + ") must not exceed autoSelectThreshold (" + autoSelectThreshold + ")");
    }
  }

  public static RecommendationSettings defaults() {
    return new RecommendationSettings(DEFAULT_AUTO_SELECT_THRESHOLD, DEFAULT_DISPLAY_THRESHOLD);
  }
}
