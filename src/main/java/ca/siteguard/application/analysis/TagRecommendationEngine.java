package ca.siteguard.application.analysis;

import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.tag.ComplianceTag;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.domain.tag.RecommendationReason;
import ca.siteguard.domain.tag.TagRecommendation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns fused hazards into compliance-tag recommendations.
 * <p><strong>Why:</strong> Inspectors apply tags, not hazard codes; strong findings are pre-selected and weaker
 * ones offered as suggestions so the user stays in control.</p>
 * <p><strong>Role:</strong> Stateless application service invoked in the RECOMMENDING stage of a session.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>A tag reached by several hazards appears once, with the highest of their confidences.</li>
 *   <li>At or above the auto-select threshold the tag is {@link RecommendationReason#AUTO_SELECTED}; at or above
 *   the display threshold it is {@link RecommendationReason#SUGGESTED}; below that it is dropped.</li>
 *   <li>Ordering is auto-selected first, then confidence, then tag priority rank, then tag id.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Observes {@code analysis.recommend.autoSelected}; increments
 * {@code analysis.recommend.unmappedHazard} for hazards the taxonomy does not know.</p>
 *
 * @since SiteGuard 0.1
 */
public final class TagRecommendationEngine {
  private static final Logger log = LoggerFactory.getLogger(TagRecommendationEngine.class);

  private static final Comparator<TagRecommendation> ORDER = Comparator
      .comparing((TagRecommendation r) -> !r.autoSelected())
      .thenComparing(Comparator.comparingDouble(TagRecommendation::confidence).reversed())
      .thenComparingInt(r -> r.tag().priorityRank())
      .thenComparing(TagRecommendation::tagId);

  private final HazardTaxonomy taxonomy;
  private final RecommendationSettings settings;
  private final MetricsPort metrics;

  /**
   * Creates a recommendation engine.
   *
   * @param taxonomy hazard-to-tag mapping
   * @param settings thresholds
   * @param metrics metrics sink
   */
  public TagRecommendationEngine(
      HazardTaxonomy taxonomy, RecommendationSettings settings, MetricsPort metrics) {
    this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Produces recommendations for a session.
   *
   * @param hazards fused hazards in any order
   * @return ordered recommendations and the auto-select set
   */
  public TagRecommendations recommend(List<FusedHazard> hazards) {
    Objects.requireNonNull(hazards, "hazards");
    Map<String, Candidate> candidates = new TreeMap<>();
    for (FusedHazard hazard : hazards) {
      List<ComplianceTag> tags = taxonomy.tagsFor(hazard.type());
      if (tags.isEmpty()) {
        log.debug("No compliance tags mapped for hazard type {}", hazard.type());
        metrics.increment("analysis.recommend.unmappedHazard");
        continue;
      }
      for (ComplianceTag tag : tags) {
        candidates.computeIfAbsent(tag.id(), id -> new Candidate(tag)).accept(hazard);
      }
    }

    List<TagRecommendation> recommendations = new ArrayList<>();
    for (Candidate candidate : candidates.values()) {
      double confidence = candidate.confidence;
      RecommendationReason reason;
      if (confidence >= settings.autoSelectThreshold()) {
        reason = RecommendationReason.AUTO_SELECTED;
      } else if (confidence >= settings.displayThreshold()) {
        reason = RecommendationReason.SUGGESTED;
      } else {
        continue;
      }
      recommendations.add(new TagRecommendation(
          candidate.tag, confidence, reason, new ArrayList<>(candidate.triggeredBy)));
    }
    recommendations.sort(ORDER);

    Set<String> autoSelect = new LinkedHashSet<>();
    for (TagRecommendation recommendation : recommendations) {
      if (recommendation.autoSelected()) {
        autoSelect.add(recommendation.tagId());
      }
    }
    metrics.observe("analysis.recommend.autoSelected", autoSelect.size());
    return new TagRecommendations(recommendations, autoSelect);
  }

  private static final class Candidate {
    private final ComplianceTag tag;
    private final Set<HazardType> triggeredBy = new TreeSet<>();
    private double confidence;

    private Candidate(ComplianceTag tag) {
      this.tag = tag;
    }

    private void accept(FusedHazard hazard) {
      confidence = Math.max(confidence, hazard.confidence());
      triggeredBy.add(hazard.type());
    }
  }
}
