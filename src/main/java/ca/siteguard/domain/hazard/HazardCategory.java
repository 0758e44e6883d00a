package ca.siteguard.domain.hazard;

import java.util.Locale;

/**
 * Broad hazard families used to describe what a backend can detect and how tags are grouped.
 *
 * @since SiteGuard 0.1
 */
public enum HazardCategory {
  /** Personal protective equipment. */
  PPE,
  /** Falls, edges, ladders, scaffolds. */
  FALL_PROTECTION,
  /** Exposed wiring, panels, lockout. */
  ELECTRICAL,
  /** Heavy equipment and machinery operation. */
  EQUIPMENT,
  /** Debris, trip hazards, material storage. */
  HOUSEKEEPING,
  /** Fire protection and hot work. */
  FIRE,
  /** Excavation, confined space, atmosphere. */
  ENVIRONMENTAL,
  /** Anything without a more specific family. */
  GENERAL;

  /**
   * Parses a category name case-insensitively, accepting hyphens and spaces for underscores.
   *
   * @param value raw category label
   * @return parsed category
   * @throws IllegalArgumentException when the label is unknown
   */
  public static HazardCategory fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    try {
      return HazardCategory.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown hazard category: " + value, ex);
    }
  }
}
