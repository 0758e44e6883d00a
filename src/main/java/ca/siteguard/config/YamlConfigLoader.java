package ca.siteguard.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a SiteGuard YAML file into a {@link ProfiledConfig}.
 *
 * <p>The top level holds a {@code common} section plus one section per deployment profile ({@code field},
 * {@code office}, ...). Nested keys are flattened to the dotted form {@link AnalysisConfig#fromMap(Map)} accepts, so
 * {@code timeout: {localMillis: 2000}} becomes {@code timeout.localMillis=2000}.</p>
 *
 * @since SiteGuard 0.1
 */
public final class YamlConfigLoader {
  static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Parses {@code path}.
   *
   * @param path YAML configuration file
   * @return common settings and per-profile overrides, all flattened
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structure
   */
  public static ProfiledConfig read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return new ProfiledConfig(Map.of(), Map.of());
    }

    Map<String, String> common = Map.of();
    Map<String, Map<String, String>> profiles = new TreeMap<>();
    for (Map.Entry<String, Object> section : sections(document, "root").entrySet()) {
      String name = section.getKey().trim().toLowerCase(Locale.ROOT);
      Map<String, String> flat = new LinkedHashMap<>();
      if (section.getValue() != null) {
        flatten(sections(section.getValue(), name), "", flat);
      }
      if (name.equals(COMMON)) {
        common = flat;
      } else if (profiles.put(name, flat) != null) {
        throw new IllegalArgumentException("Profile " + name + " is declared more than once");
      }
    }
    return new ProfiledConfig(common, profiles);
  }

  private static Map<String, Object> sections(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        flatten(sections(value, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + dotted);
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
