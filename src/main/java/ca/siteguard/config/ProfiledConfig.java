package ca.siteguard.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Flattened contents of a SiteGuard YAML file.
 *
 * @param common settings shared by every profile
 * @param profiles overrides per lower-cased profile name
 * @since SiteGuard 0.1
 */
public record ProfiledConfig(Map<String, String> common, Map<String, Map<String, String>> profiles) {
  public ProfiledConfig {
    common = Map.copyOf(common);
    profiles = profiles.entrySet().stream()
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> Map.copyOf(e.getValue())));
  }

  public Set<String> profileNames() {
    return profiles.keySet();
  }

  /**
   * Layers the named profile over {@code common}.
   *
   * @param profile profile name, case-insensitive
   * @return merged settings
   * @throws IllegalArgumentException when the file declares no such profile
   */
  public Map<String, String> forProfile(String profile) {
    String name = normalize(profile);
    Map<String, String> overrides = profiles.get(name);
    if (overrides == null) {
      throw new IllegalArgumentException(
          "Unknown profile " + name + "; configuration declares " + new TreeSet<>(profiles.keySet()));
    }
    return merge(overrides);
  }

  /**
   * Layers the named profile over {@code common} when the file declares it, otherwise returns {@code common}.
   *
   * @param profile profile name, case-insensitive
   * @return merged settings
   */
  public Map<String, String> forProfileOrCommon(String profile) {
    return merge(profiles.getOrDefault(normalize(profile), Map.of()));
  }

  private Map<String, String> merge(Map<String, String> overrides) {
    Map<String, String> merged = new LinkedHashMap<>(common);
    merged.putAll(overrides);
    return Map.copyOf(merged);
  }

  private static String normalize(String profile) {
    return Objects.requireNonNull(profile, "profile").trim().toLowerCase(Locale.ROOT);
  }
}
