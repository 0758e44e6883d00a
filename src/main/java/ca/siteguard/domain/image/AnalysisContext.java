package ca.siteguard.domain.image;

import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied hints for one analysis request.
 *
 * @param workType kind of work being inspected (for example {@code "roofing"}); empty when unknown
 * @param recallPriority {@code true} when finding every hazard matters more than latency or cost; enables
 *     hybrid analysis when connectivity allows
 * @param attributes free-form attributes passed through to backends
 * @since SiteGuard 0.1
 */
public record AnalysisContext(String workType, boolean recallPriority, Map<String, String> attributes) {

  /** Context with no work type, default recall and no attributes. */
  public static final AnalysisContext DEFAULT = new AnalysisContext("", false, Map.of());

  public AnalysisContext {
    workType = workType == null ? "" : workType.trim();
    attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes"));
  }

  /**
   * Returns a copy with recall priority switched on.
   *
   * @return context preferring recall
   */
  public AnalysisContext withRecallPriority() {
    return new AnalysisContext(workType, true, attributes);
  }
}
