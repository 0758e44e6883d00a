package ca.siteguard.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides; may be {@code null}
   * @param defaults embedded defaults; may be {@code null}
   * @param warn consumer invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when a key is not recognized
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    for (String key : merged.keySet()) {
      if (!AnalysisConfig.KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown configuration key: " + key);
      }
    }
    return Map.copyOf(merged);
  }
}
