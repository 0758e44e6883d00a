package ca.siteguard.application.analysis;

import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.hazard.BoundingRegion;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardDetection;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges detections from one or more backends into a ranked list of fused hazards.
 * <p><strong>Why:</strong> Overlapping reports of the same condition must appear once, and agreement between
 * backends should raise confidence while a single weak source cannot.</p>
 * <p><strong>Role:</strong> Stateless application service invoked in the FUSING stage of a session.</p>
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>Detections are grouped by hazard type and clustered by region overlap (IoU at or above the threshold).
 *   Overlapping pairs are merged highest IoU first. A merge is refused when it would put two detections from the
 *   same backend into one cluster without their own regions overlapping, so one backend's separate reports
 *   stay separate hazards even when another backend's box bridges them.</li>
 *   <li>Within a cluster, each backend contributes only its highest-confidence detection.</li>
 *   <li>Clusters with several backends use the weighted mean boosted by
 *   {@code 1 + boost * (backends - 1)}, capped at 1. Single-backend clusters use confidence times weight,
 *   clamped to {@code [0, 1]}.</li>
 *   <li>Output is ordered by confidence, then severity, then type code, then region.</li>
 * </ol>
 * <p><strong>Determinism:</strong> Inputs are put in a canonical order before any arithmetic, so permuting batches
 * or re-running on the same input yields bit-identical output.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Observes {@code analysis.fusion.clusters}.</p>
 *
 * @since SiteGuard 0.1
 */
public final class ResultFusionEngine {
  private static final Logger log = LoggerFactory.getLogger(ResultFusionEngine.class);

  private static final Comparator<Member> CANONICAL = Comparator
      .comparing((Member m) -> m.detection().backendId())
      .thenComparing(Comparator.comparingDouble((Member m) -> m.detection().confidence()).reversed())
      .thenComparing(m -> m.detection().region())
      .thenComparing(m -> m.detection().detectedAt());

  private static final Comparator<Edge> EDGE_ORDER = Comparator
      .comparingDouble(Edge::iou).reversed()
      .thenComparingInt(Edge::a)
      .thenComparingInt(Edge::b);

  private static final Comparator<FusedHazard> RANKING = Comparator
      .comparingDouble(FusedHazard::confidence).reversed()
      .thenComparing(Comparator.comparingInt((FusedHazard h) -> h.severity().rank()).reversed())
      .thenComparing(FusedHazard::type)
      .thenComparing(FusedHazard::region);

  private final FusionSettings settings;
  private final HazardTaxonomy taxonomy;
  private final MetricsPort metrics;

  /**
   * Creates a fusion engine.
   *
   * @param settings clustering threshold and weights
   * @param taxonomy source of hazard severities
   * @param metrics metrics sink
   */
  public ResultFusionEngine(FusionSettings settings, HazardTaxonomy taxonomy, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Fuses detection batches.
   *
   * @param batches one batch per successful backend call; order is irrelevant
   * @return fused hazards, best first; empty when no batch carries detections
   */
  public List<FusedHazard> fuse(Collection<DetectionBatch> batches) {
    Objects.requireNonNull(batches, "batches");
    Map<HazardType, List<Member>> byType = new TreeMap<>();
    for (DetectionBatch batch : batches) {
      double weight = settings.weightFor(batch.backendId(), batch.tier());
      for (HazardDetection detection : batch.detections()) {
        byType.computeIfAbsent(detection.type(), t -> new ArrayList<>())
            .add(new Member(detection, weight));
      }
    }

    List<FusedHazard> fused = new ArrayList<>();
    for (Map.Entry<HazardType, List<Member>> entry : byType.entrySet()) {
      List<Member> members = entry.getValue();
      members.sort(CANONICAL);
      for (List<Member> cluster : cluster(members)) {
        fused.add(fuseCluster(entry.getKey(), cluster));
      }
    }
    fused.sort(RANKING);
    metrics.observe("analysis.fusion.clusters", fused.size());
    if (log.isDebugEnabled()) {
      log.debug("Fused {} batches into {} hazards", batches.size(), fused.size());
    }
    return List.copyOf(fused);
  }

  private List<List<Member>> cluster(List<Member> members) {
    int n = members.size();
    double[][] overlap = new double[n][n];
    List<Edge> edges = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      BoundingRegion a = members.get(i).detection().region();
      for (int j = i + 1; j < n; j++) {
        double iou = a.intersectionOverUnion(members.get(j).detection().region());
        overlap[i][j] = iou;
        overlap[j][i] = iou;
        if (iou >= settings.iouThreshold()) {
          edges.add(new Edge(i, j, iou));
        }
      }
    }
    edges.sort(EDGE_ORDER);

    int[] groupOf = new int[n];
    List<List<Integer>> groups = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      groupOf[i] = i;
      groups.add(new ArrayList<>(List.of(i)));
    }
    for (Edge edge : edges) {
      int target = groupOf[edge.a()];
      int source = groupOf[edge.b()];
      if (target == source || !compatible(groups.get(target), groups.get(source), members, overlap)) {
        continue;
      }
      for (int index : groups.get(source)) {
        groupOf[index] = target;
      }
      groups.get(target).addAll(groups.get(source));
      groups.get(source).clear();
    }

    List<List<Member>> clusters = new ArrayList<>();
    for (List<Integer> group : groups) {
      if (group.isEmpty()) {
        continue;
      }
      Collections.sort(group);
      List<Member> cluster = new ArrayList<>(group.size());
      for (int index : group) {
        cluster.add(members.get(index));
      }
      clusters.add(cluster);
    }
    return clusters;
  }

  private boolean compatible(
      List<Integer> left, List<Integer> right, List<Member> members, double[][] overlap) {
    for (int p : left) {
      String backendId = members.get(p).detection().backendId();
      for (int q : right) {
        if (backendId.equals(members.get(q).detection().backendId())
            && overlap[p][q] < settings.iouThreshold()) {
          return false;
        }
      }
    }
    return true;
  }

  private FusedHazard fuseCluster(HazardType type, List<Member> cluster) {
    // Members arrive sorted by backend then confidence desc, so the first per backend is its best.
    Map<String, Member> bestPerBackend = new LinkedHashMap<>();
    for (Member member : cluster) {
      bestPerBackend.putIfAbsent(member.detection().backendId(), member);
    }
    List<Member> representatives = new ArrayList<>(bestPerBackend.values());

    double confidence;
    if (representatives.size() == 1) {
      Member only = representatives.get(0);
      confidence = clamp(only.detection().confidence() * only.weight());
    } else {
      double weightedSum = 0d;
      double weightTotal = 0d;
      for (Member member : representatives) {
        weightedSum += member.weight() * member.detection().confidence();
        weightTotal += member.weight();
      }
      double weightedAverage = weightedSum / weightTotal;
      double boost = 1d + settings.agreementBoost() * (representatives.size() - 1);
      confidence = clamp(weightedAverage * boost);
    }

    Member strongest = representatives.get(0);
    for (Member member : representatives) {
      double score = member.weight() * member.detection().confidence();
      if (score > strongest.weight() * strongest.detection().confidence()) {
        strongest = member;
      }
    }

    return new FusedHazard(
        type,
        confidence,
        taxonomy.severityOf(type),
        strongest.detection().region(),
        new ArrayList<>(bestPerBackend.keySet()),
        cluster.size());
  }

  private static double clamp(double value) {
    return Math.max(0d, Math.min(1d, value));
  }

  private record Member(HazardDetection detection, double weight) {}

  private record Edge(int a, int b, double iou) {}
}
