package ca.siteguard.domain.tag;

import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.validation.Numbers;
import ca.siteguard.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> User-facing compliance label tied to one or more regulatory references.
 * <p><strong>Why:</strong> Tags are what inspectors apply to photos; the regulatory codes let reports cite the
 * standard that a hazard violates.</p>
 * <p><strong>Role:</strong> Static domain data loaded once into {@link HazardTaxonomy}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id stable identifier such as {@code ppe-hard-hat-required}
 * @param displayName label shown to users
 * @param category hazard family the tag belongs to
 * @param regulatoryCodes references such as {@code 29 CFR 1926.100}
 * @param priorityRank ordering rank in {@code [1, 1000]}; lower ranks sort first on ties
 * @since SiteGuard 0.1
 */
public record ComplianceTag(
    String id,
    String displayName,
    HazardCategory category,
    List<String> regulatoryCodes,
    int priorityRank) {

  /** Accepted shape for regulatory references, for example {@code 29 CFR 1926.501(b)(1)}. */
  public static final Pattern REGULATORY_CODE = Pattern.compile("^\\d+\\s+(CFR|USC)\\s+\\d+(\\.\\d+)*.*");

  /**
   * Validates identifiers, codes and rank.
   *
   * @throws IllegalArgumentException when the id is not an identifier, a code is malformed or the rank is out of range
   */
  public ComplianceTag {
    id = Strings.requireIdentifier("tag id", id);
    displayName = Strings.requireNonBlank("tag name", displayName);
    Objects.requireNonNull(category, "category");
    regulatoryCodes = List.copyOf(Objects.requireNonNull(regulatoryCodes, "regulatoryCodes"));
    for (String code : regulatoryCodes) {
      if (!REGULATORY_CODE.matcher(code).matches()) {
        throw new IllegalArgumentException("tag " + id + " has malformed regulatory code: " + code);
      }
    }
    Numbers.requireRange("tag priority", priorityRank, 1, 1000);
  }
}
