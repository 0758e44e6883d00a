package ca.siteguard.application.analysis;

import ca.siteguard.domain.hazard.BoundingRegion;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardDetection;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.hazard.Severity;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.image.CaptureMetadata;
import ca.siteguard.domain.tag.ComplianceTag;
import ca.siteguard.domain.tag.HazardMapping;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.time.Instant;
import java.util.List;

/** Shared taxonomy, images and detections for analysis tests. */
final class AnalysisFixtures {
  static final Instant CAPTURED_AT = Instant.parse("2024-05-01T14:30:00Z");

  static final HazardType HARD_HAT = HazardType.of("MISSING_HARD_HAT");
  static final HazardType SAFETY_VEST = HazardType.of("MISSING_SAFETY_VEST");
  static final HazardType FALL = HazardType.of("WORKING_AT_HEIGHT_WITHOUT_PROTECTION");
  static final HazardType DEBRIS = HazardType.of("DEBRIS_ACCUMULATION");
  static final HazardType UNMAPPED = HazardType.of("UNKNOWN_CONDITION");

  static final BoundingRegion LEFT = new BoundingRegion(0.0d, 0.0d, 0.4d, 0.4d);
  static final BoundingRegion LEFT_HALF_OVERLAP = new BoundingRegion(0.0d, 0.0d, 0.4d, 0.2d);
  static final BoundingRegion RIGHT = new BoundingRegion(0.6d, 0.6d, 0.3d, 0.3d);

  private AnalysisFixtures() {}

  static HazardTaxonomy taxonomy() {
    List<ComplianceTag> tags = List.of(
        new ComplianceTag("ppe-hard-hat-required", "Hard hat required", HazardCategory.PPE,
            List.of("29 CFR 1926.100"), 10),
        new ComplianceTag("ppe-high-visibility", "High-visibility apparel", HazardCategory.PPE,
            List.of("29 CFR 1926.201"), 20),
        new ComplianceTag("fall-protection-required", "Fall protection required",
            HazardCategory.FALL_PROTECTION, List.of("29 CFR 1926.501"), 5),
        new ComplianceTag("housekeeping-debris", "Debris accumulation", HazardCategory.HOUSEKEEPING,
            List.of("29 CFR 1926.25"), 70));
    List<HazardMapping> hazards = List.of(
        new HazardMapping(HARD_HAT, Severity.HIGH, HazardCategory.PPE,
            List.of("ppe-hard-hat-required"), List.of("no_helmet")),
        new HazardMapping(SAFETY_VEST, Severity.MEDIUM, HazardCategory.PPE,
            List.of("ppe-high-visibility"), List.of()),
        new HazardMapping(FALL, Severity.CRITICAL, HazardCategory.FALL_PROTECTION,
            List.of("fall-protection-required"), List.of()),
        new HazardMapping(DEBRIS, Severity.LOW, HazardCategory.HOUSEKEEPING,
            List.of("housekeeping-debris"), List.of("debris")));
    return new HazardTaxonomy(tags, hazards);
  }

  static AnalysisImage image() {
    return new AnalysisImage(new byte[] {1, 2, 3, 4}, 640, 480, CaptureMetadata.at(CAPTURED_AT));
  }

  static HazardDetection detection(String backendId, HazardType type, double confidence, BoundingRegion region) {
    return new HazardDetection(type, confidence, region, backendId, CAPTURED_AT);
  }

  static FusedHazard fused(HazardType type, double confidence) {
    return new FusedHazard(type, confidence, Severity.MEDIUM, BoundingRegion.FULL_FRAME, List.of("on-device"), 1);
  }
}
