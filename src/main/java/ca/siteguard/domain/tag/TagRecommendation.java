package ca.siteguard.domain.tag;

import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.validation.Numbers;
import java.util.List;
import java.util.Objects;

/**
 * Recommendation of one compliance tag for an analyzed image.
 *
 * @param tag recommended tag
 * @param confidence highest confidence among the hazards that map to the tag
 * @param reason whether the tag is auto-selected or only suggested
 * @param triggeredBy sorted hazard types that map to this tag
 * @since SiteGuard 0.1
 */
public record TagRecommendation(
    ComplianceTag tag,
    double confidence,
    RecommendationReason reason,
    List<HazardType> triggeredBy) {

  public TagRecommendation {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(reason, "reason");
    Numbers.requireUnitInterval("confidence", confidence);
    triggeredBy = List.copyOf(Objects.requireNonNull(triggeredBy, "triggeredBy"));
  }

  /**
   * Convenience accessor for the tag id.
   *
   * @return tag identifier
   */
  public String tagId() {
    return tag.id();
  }

  public boolean autoSelected() {
    return reason == RecommendationReason.AUTO_SELECTED;
  }
}
