package ca.siteguard.domain.tag;

/**
 * Why a tag made it into the recommendation list.
 *
 * @since SiteGuard 0.1
 */
public enum RecommendationReason {
  /** Confidence met the auto-select threshold; the tag is pre-selected for the user. */
  AUTO_SELECTED,
  /** Confidence met the display threshold only; the user must opt in. */
  SUGGESTED
}
