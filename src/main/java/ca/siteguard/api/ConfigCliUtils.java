package ca.siteguard.api;

import ca.siteguard.config.AnalysisConfig;
import ca.siteguard.config.ConfigMerger;
import ca.siteguard.config.ProfiledConfig;
import ca.siteguard.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared configuration handling for the CLI commands.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  static final String DEFAULT_PROFILE = "field";

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} and {@code profile} from {@code args}, then merges defaults, the YAML file and the
   * remaining arguments. An explicit {@code profile} must exist in the file; without one the {@code field} profile
   * applies when the file declares it.
   *
   * @param args mutable CLI map; command-specific keys must already be removed
   * @return validated configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the file or the requested profile is missing, or any value is invalid
   */
  static AnalysisConfig loadConfig(Map<String, String> args) throws IOException {
    String configPath = args.remove("config");
    String profile = args.remove("profile");
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + path);
      }
      ProfiledConfig file = YamlConfigLoader.read(path);
      yaml = Optional.of(profile == null
          ? file.forProfileOrCommon(DEFAULT_PROFILE)
          : file.forProfile(profile));
      log.debug("Loaded configuration from {} (profiles {})", path, file.profileNames());
    }
    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig(yaml, args, AnalysisConfig.defaultsAsFlatMap(), log::warn);
    return AnalysisConfig.fromMap(effective);
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
