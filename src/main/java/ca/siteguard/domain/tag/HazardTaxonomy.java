package ca.siteguard.domain.tag;

import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.hazard.Severity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Read-only lookup from hazard type to severity, category and compliance tags.
 * <p><strong>Why:</strong> Keeps the regulatory mapping as data so tagging rules change without touching the
 * fusion or recommendation code.</p>
 * <p><strong>Role:</strong> Domain aggregate built by the taxonomy loader and shared by fusion, recommendation
 * and backend adapters (for label aliases).</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share across sessions.</p>
 *
 * @since SiteGuard 0.1
 */
public final class HazardTaxonomy {
  private final Map<String, ComplianceTag> tagsById;
  private final Map<HazardType, HazardMapping> mappings;
  private final Map<String, HazardType> aliases;

  /**
   * Builds a taxonomy, checking cross references.
   *
   * @param tags compliance tags; ids must be unique
   * @param hazards hazard mappings; every referenced tag id must exist
   * @throws IllegalArgumentException on duplicate tag ids, duplicate hazard types, unknown tag references or
   *     an alias claimed by two hazard types
   */
  public HazardTaxonomy(Collection<ComplianceTag> tags, Collection<HazardMapping> hazards) {
    Objects.requireNonNull(tags, "tags");
    Objects.requireNonNull(hazards, "hazards");
    Map<String, ComplianceTag> byId = new LinkedHashMap<>();
    for (ComplianceTag tag : tags) {
      if (byId.putIfAbsent(tag.id(), tag) != null) {
        throw new IllegalArgumentException("Duplicate tag id: " + tag.id());
      }
    }
    Map<HazardType, HazardMapping> byType = new TreeMap<>();
    Map<String, HazardType> aliasIndex = new HashMap<>();
    for (HazardMapping mapping : hazards) {
      if (byType.putIfAbsent(mapping.type(), mapping) != null) {
        throw new IllegalArgumentException("Duplicate hazard type: " + mapping.type());
      }
      for (String tagId : mapping.tagIds()) {
        if (!byId.containsKey(tagId)) {
          throw new IllegalArgumentException(
              "Hazard " + mapping.type() + " references unknown tag: " + tagId);
        }
      }
      for (String alias : mapping.aliases()) {
        String key = HazardType.of(alias).code();
        HazardType previous = aliasIndex.putIfAbsent(key, mapping.type());
        if (previous != null && !previous.equals(mapping.type())) {
          throw new IllegalArgumentException(
              "Alias " + alias + " maps to both " + previous + " and " + mapping.type());
        }
      }
    }
    this.tagsById = Collections.unmodifiableMap(byId);
    this.mappings = Collections.unmodifiableMap(byType);
    this.aliases = Map.copyOf(aliasIndex);
  }

  /**
   * Returns an empty taxonomy; every hazard resolves to defaults and maps to no tags.
   *
   * @return empty taxonomy
   */
  public static HazardTaxonomy empty() {
    return new HazardTaxonomy(List.of(), List.of());
  }

  /**
   * Returns the compliance tags mapped to a hazard type, in declaration order.
   *
   * @param type hazard type
   * @return tags; empty when the type is unmapped
   */
  public List<ComplianceTag> tagsFor(HazardType type) {
    HazardMapping mapping = mappings.get(type);
    if (mapping == null) {
      return List.of();
    }
    List<ComplianceTag> result = new ArrayList<>(mapping.tagIds().size());
    for (String tagId : mapping.tagIds()) {
      result.add(tagsById.get(tagId));
    }
    return List.copyOf(result);
  }

  /**
   * Returns the severity of a hazard type, {@link Severity#MEDIUM} when unmapped.
   *
   * @param type hazard type
   * @return severity
   */
  public Severity severityOf(HazardType type) {
    HazardMapping mapping = mappings.get(type);
    return mapping == null ? Severity.MEDIUM : mapping.severity();
  }

  /**
   * Returns the category of a hazard type, {@link HazardCategory#GENERAL} when unmapped.
   *
   * @param type hazard type
   * @return category
   */
  public HazardCategory categoryOf(HazardType type) {
    HazardMapping mapping = mappings.get(type);
    return mapping == null ? HazardCategory.GENERAL : mapping.category();
  }

  public boolean isMapped(HazardType type) {
    return mappings.containsKey(type);
  }

  public Optional<ComplianceTag> tag(String id) {
    return Optional.ofNullable(tagsById.get(id));
  }

  /**
   * Lists all tags in declaration order.
   *
   * @return immutable tag list
   */
  public List<ComplianceTag> tags() {
    return List.copyOf(tagsById.values());
  }

  /**
   * Lists all hazard mappings ordered by hazard type code.
   *
   * @return immutable mapping list
   */
  public List<HazardMapping> mappings() {
    return List.copyOf(mappings.values());
  }

  /**
   * Resolves a raw engine label to a hazard type.
   *
   * <p>The label is normalized first. A label equal to a known hazard code resolves to it directly; otherwise
   * the alias index is consulted.</p>
   *
   * @param label raw engine label such as {@code "no_hard_hat"}
   * @return hazard type, or empty when the label is blank or unknown
   */
  public Optional<HazardType> resolveLabel(String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    HazardType normalized;
    try {
      normalized = HazardType.of(label);
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
    if (mappings.containsKey(normalized)) {
      return Optional.of(normalized);
    }
    return Optional.ofNullable(aliases.get(normalized.code()));
  }
}
