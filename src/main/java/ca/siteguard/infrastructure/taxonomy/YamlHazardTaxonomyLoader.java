package ca.siteguard.infrastructure.taxonomy;

import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.hazard.Severity;
import ca.siteguard.domain.tag.ComplianceTag;
import ca.siteguard.domain.tag.HazardMapping;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the hazard taxonomy (compliance tags and hazard mappings) from a version 1 YAML document.
 *
 * <pre>
 * version: 1
 * tags:
 *   - id: ppe-hard-hat-required
 *     name: Hard hat required
 *     category: ppe
 *     priority: 10
 *     codes: ["29 CFR 1926.100"]
 * hazards:
 *   MISSING_HARD_HAT:
 *     severity: high
 *     category: ppe
 *     tags: [ppe-hard-hat-required]
 *     aliases: [no_hard_hat]
 * </pre>
 *
 * <p>Structural errors surface as {@link IllegalArgumentException}; a missing file as {@link IOException}.</p>
 *
 * @since SiteGuard 0.1
 */
public final class YamlHazardTaxonomyLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlHazardTaxonomyLoader.class);

  /** Classpath location of the bundled taxonomy. */
  public static final String DEFAULT_RESOURCE = "hazard-taxonomy.yaml";

  private static final int SUPPORTED_VERSION = 1;

  /**
   * Loads the taxonomy bundled on the classpath.
   *
   * @return parsed taxonomy
   * @throws IOException when the resource is missing or unreadable
   */
  public HazardTaxonomy loadDefault() throws IOException {
    return loadResource(DEFAULT_RESOURCE);
  }

  /**
   * Loads a taxonomy from a classpath resource.
   *
   * @param resource resource name relative to the classpath root
   * @return parsed taxonomy
   * @throws IOException when the resource is missing or unreadable
   */
  public HazardTaxonomy loadResource(String resource) throws IOException {
    Objects.requireNonNull(resource, "resource");
    ClassLoader loader = YamlHazardTaxonomyLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Taxonomy resource not found on classpath: " + resource);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + resource);
    }
  }

  /**
   * Loads a taxonomy from a file.
   *
   * @param path YAML file
   * @return parsed taxonomy
   * @throws IOException when the file is missing or unreadable
   */
  public HazardTaxonomy load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Taxonomy file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  HazardTaxonomy parse(Reader reader, String source) {
    Object rootObj;
    try {
      rootObj = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse taxonomy YAML at " + source, ex);
    }
    if (rootObj == null) {
      throw new IllegalArgumentException("Taxonomy document is empty: " + source);
    }
    Map<String, Object> root = asMap(rootObj, "root");
    int version = toInt(root.get("version"), "version");
    if (version != SUPPORTED_VERSION) {
      throw new IllegalArgumentException("Unsupported taxonomy version " + version + " in " + source);
    }

    List<ComplianceTag> tags = new ArrayList<>();
    Object tagsNode = root.get("tags");
    if (tagsNode != null) {
      if (!(tagsNode instanceof Iterable<?> iterable)) {
        throw new IllegalArgumentException("tags must be a list");
      }
      for (Object tagNode : iterable) {
        tags.add(parseTag(asMap(tagNode, "tag")));
      }
    }

    List<HazardMapping> hazards = new ArrayList<>();
    Object hazardsNode = root.get("hazards");
    if (hazardsNode != null) {
      for (Map.Entry<String, Object> entry : asMap(hazardsNode, "hazards").entrySet()) {
        hazards.add(parseHazard(entry.getKey(), asMap(entry.getValue(), "hazard " + entry.getKey())));
      }
    }

    HazardTaxonomy taxonomy = new HazardTaxonomy(tags, hazards);
    log.info("Loaded hazard taxonomy from {} ({} tags, {} hazard types)", source, tags.size(), hazards.size());
    return taxonomy;
  }

  private ComplianceTag parseTag(Map<String, Object> map) {
    String id = requireString(map, "id");
    String name = requireString(map, "name");
    HazardCategory category = HazardCategory.fromString(requireString(map, "category"));
    int priority = toInt(map.get("priority"), "priority of tag " + id);
    List<String> codes = toStringList(map.get("codes"), "codes of tag " + id);
    return new ComplianceTag(id, name, category, codes, priority);
  }

  private HazardMapping parseHazard(String code, Map<String, Object> map) {
    HazardType type = HazardType.of(code);
    Severity severity = Severity.fromString(requireString(map, "severity"));
    HazardCategory category = HazardCategory.fromString(requireString(map, "category"));
    List<String> tagIds = toStringList(map.get("tags"), "tags of hazard " + code);
    List<String> aliases = toStringList(map.get("aliases"), "aliases of hazard " + code);
    return new HazardMapping(type, severity, category, tagIds, aliases);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return value.toString().trim();
  }

  private List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof String single) {
      return single.isBlank() ? List.of() : List.of(single.trim());
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException(context + " must be a list of strings");
    }
    List<String> values = new ArrayList<>();
    for (Object item : iterable) {
      if (item == null || item.toString().isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank entry");
      }
      values.add(item.toString().trim());
    }
    return List.copyOf(values);
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }
}
