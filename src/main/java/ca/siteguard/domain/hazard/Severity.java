package ca.siteguard.domain.hazard;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity classes attached to hazard types by the taxonomy.
 * <p><strong>Role:</strong> Secondary sort key for fused hazards (critical &gt; high &gt; medium &gt; low).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since SiteGuard 0.1
 */
public enum Severity {
  /** Imminent danger to life; work should stop. */
  CRITICAL(4),
  /** Serious injury likely if left uncorrected. */
  HIGH(3),
  /** Injury possible; correct during the shift. */
  MEDIUM(2),
  /** Housekeeping or minor issue. */
  LOW(1);

  private final int rank;

  Severity(int rank) {
    this.rank = rank;
  }

  /**
   * Returns the ordering rank; larger values are more severe.
   *
   * @return rank between 1 and 4
   */
  public int rank() {
    return rank;
  }

  /**
   * Parses a severity name case-insensitively.
   *
   * @param value severity label such as {@code "high"}
   * @return matching severity
   * @throws IllegalArgumentException when the label is unknown or blank
   */
  public static Severity fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    try {
      return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown severity: " + value, ex);
    }
  }
}
