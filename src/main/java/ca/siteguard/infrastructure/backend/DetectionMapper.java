package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.application.port.RawDetection;
import ca.siteguard.domain.hazard.BoundingRegion;
import ca.siteguard.domain.hazard.HazardDetection;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.validation.Numbers;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts engine output into {@link HazardDetection}s: resolves labels through the taxonomy, drops invalid or
 * low-confidence entries and normalizes boxes.
 */
final class DetectionMapper {
  private static final Logger log = LoggerFactory.getLogger(DetectionMapper.class);

  private final String backendId;
  private final HazardTaxonomy taxonomy;
  private final double minConfidence;
  private final MetricsPort metrics;
  private final ClockPort clock;

  DetectionMapper(
      String backendId, HazardTaxonomy taxonomy, double minConfidence, MetricsPort metrics, ClockPort clock) {
    this.backendId = Objects.requireNonNull(backendId, "backendId");
    this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
    this.minConfidence = Numbers.requireUnitInterval("minConfidence", minConfidence);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  List<HazardDetection> map(List<RawDetection> raw, AnalysisImage image) {
    Instant now = Instant.ofEpochMilli(clock.nowMillis());
    List<HazardDetection> detections = new ArrayList<>(raw.size());
    for (RawDetection detection : raw) {
      double confidence = detection.confidence();
      if (!Double.isFinite(confidence) || confidence < 0d || confidence > 1d) {
        log.debug("{} reported out-of-range confidence {} for {}", backendId, confidence, detection.label());
        metrics.increment("analysis.backend." + backendId + ".invalidDetection");
        continue;
      }
      if (confidence < minConfidence) {
        continue;
      }
      Optional<HazardType> type = taxonomy.resolveLabel(detection.label());
      if (type.isEmpty()) {
        log.debug("{} reported unmapped label {}", backendId, detection.label());
        metrics.increment("analysis.backend." + backendId + ".unmappedLabel");
        continue;
      }
      detections.add(new HazardDetection(type.get(), confidence, regionOf(detection, image), backendId, now));
    }
    return detections;
  }

  private static BoundingRegion regionOf(RawDetection detection, AnalysisImage image) {
    if (!detection.localized()) {
      return BoundingRegion.FULL_FRAME;
    }
    return BoundingRegion.fromPixels(
        detection.x(), detection.y(), detection.width(), detection.height(), image.width(), image.height());
  }
}
