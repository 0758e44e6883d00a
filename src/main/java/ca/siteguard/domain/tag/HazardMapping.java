package ca.siteguard.domain.tag;

import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.hazard.Severity;
import java.util.List;
import java.util.Objects;

/**
 * Taxonomy entry describing one hazard type.
 *
 * @param type hazard type
 * @param severity severity used to rank fused hazards
 * @param category hazard family
 * @param tagIds ids of the compliance tags the hazard maps to, in declaration order
 * @param aliases engine labels that resolve to this hazard type
 * @since SiteGuard 0.1
 */
public record HazardMapping(
    HazardType type,
    Severity severity,
    HazardCategory category,
    List<String> tagIds,
    List<String> aliases) {

  public HazardMapping {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(category, "category");
    tagIds = List.copyOf(Objects.requireNonNull(tagIds, "tagIds"));
    aliases = List.copyOf(Objects.requireNonNull(aliases, "aliases"));
  }
}
