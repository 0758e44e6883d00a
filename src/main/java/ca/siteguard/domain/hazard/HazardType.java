package ca.siteguard.domain.hazard;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Identifier of a kind of site hazard, such as {@code MISSING_HARD_HAT}.
 * <p><strong>Why:</strong> The hazard catalogue is external data, so types are open-ended codes rather than an enum.</p>
 * <p><strong>Role:</strong> Domain value object used as the grouping key for fusion and the lookup key for the taxonomy.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param code normalized code: upper-case, words separated by underscores
 * @since SiteGuard 0.1
 */
public record HazardType(String code) implements Comparable<HazardType> {

  /**
   * Normalizes the code so that {@code "missing hard-hat"} and {@code "MISSING_HARD_HAT"} compare equal.
   *
   * @throws NullPointerException if {@code code} is {@code null}
   * @throws IllegalArgumentException if the normalized code is blank
   */
  public HazardType {
    code = normalize(Objects.requireNonNull(code, "code"));
    if (code.isEmpty()) {
      throw new IllegalArgumentException("hazard type code must not be blank");
    }
  }

  /**
   * Creates a hazard type from a raw label.
   *
   * @param code raw code or label
   * @return normalized hazard type
   */
  public static HazardType of(String code) {
    return new HazardType(code);
  }

  static String normalize(String raw) {
    String trimmed = raw.trim().toUpperCase(Locale.ROOT);
    StringBuilder out = new StringBuilder(trimmed.length());
    boolean pendingSeparator = false;
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isLetterOrDigit(c)) {
        if (pendingSeparator && out.length() > 0) {
          out.append('_');
        }
        out.append(c);
        pendingSeparator = false;
      } else {
        pendingSeparator = true;
      }
    }
    return out.toString();
  }

  @Override
  public int compareTo(HazardType other) {
    return code.compareTo(other.code);
  }

  @Override
  public String toString() {
    return code;
  }
}
