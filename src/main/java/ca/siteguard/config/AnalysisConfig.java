package ca.siteguard.config;

import ca.siteguard.application.analysis.AnalysisThrottler;
import ca.siteguard.application.analysis.CacheSettings;
import ca.siteguard.application.analysis.FusionSettings;
import ca.siteguard.application.analysis.HealthSettings;
import ca.siteguard.application.analysis.OrchestratorSettings;
import ca.siteguard.application.analysis.RecommendationSettings;
import ca.siteguard.application.port.ConnectionQuality;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.logging.Logs;
import ca.siteguard.validation.Numbers;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated analysis configuration built from a flat key/value map.
 * <p><strong>Why:</strong> Keeps thresholds, weights, timeouts and adapter settings in one place so YAML and CLI
 * sources produce identical orchestrator wiring.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param throttleMinIntervalMillis minimum spacing between accepted frames
 * @param fusion fusion thresholds and weights
 * @param recommendation auto-select and display thresholds
 * @param health rolling health window settings
 * @param orchestrator timeouts, retry factor and concurrency caps
 * @param healthStore file for persisted backend health; empty disables persistence
 * @param remote remote vision adapter settings
 * @param taxonomyPath taxonomy file; empty selects the bundled resource
 * @param connectivity connection quality assumed by the CLI host
 * @param cache photo-result cache bounds
 * @since SiteGuard 0.1
 */
public record AnalysisConfig(
    long throttleMinIntervalMillis,
    FusionSettings fusion,
    RecommendationSettings recommendation,
    HealthSettings health,
    OrchestratorSettings orchestrator,
    Optional<Path> healthStore,
    RemoteSettings remote,
    Optional<Path> taxonomyPath,
    ConnectionQuality connectivity,
    CacheSettings cache) {

  /** Every key accepted by {@link #fromMap(Map)}. */
  public static final Set<String> KNOWN_KEYS = Set.of(
      "throttle.minIntervalMillis",
      "fusion.iouThreshold",
      "fusion.agreementBoost",
      "fusion.weight.onDeviceMultimodal",
      "fusion.weight.remoteVision",
      "fusion.weight.localDetector",
      "recommend.autoSelectThreshold",
      "recommend.displayThreshold",
      "timeout.localMillis",
      "timeout.remoteMillis",
      "retry.timeoutFactor",
      "health.windowSize",
      "health.minSuccessRate",
      "health.minimumSamples",
      "health.deprioritizeMillis",
      "health.store",
      "remote.id",
      "remote.maxConcurrent",
      "remote.endpoint",
      "remote.apiKey",
      "remote.requestTimeoutMillis",
      "hybrid.enabled",
      "batch.maxConcurrency",
      "taxonomy.path",
      "connectivity.quality",
      "cache.maxEntries",
      "cache.ttlMillis");

  public AnalysisConfig {
    Numbers.requireRange("throttle.minIntervalMillis", throttleMinIntervalMillis, 0L, 60_000L);
    Objects.requireNonNull(fusion, "fusion");
    Objects.requireNonNull(recommendation, "recommendation");
    Objects.requireNonNull(health, "health");
    Objects.requireNonNull(orchestrator, "orchestrator");
    Objects.requireNonNull(healthStore, "healthStore");
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(taxonomyPath, "taxonomyPath");
    Objects.requireNonNull(connectivity, "connectivity");
    Objects.requireNonNull(cache, "cache");
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static AnalysisConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Returns the defaults as a flat map, suitable as the lowest-precedence layer for {@link ConfigMerger}.
   *
   * @return unmodifiable defaults
   */
  public static Map<String, String> defaultsAsFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("throttle.minIntervalMillis", Long.toString(AnalysisThrottler.DEFAULT_MIN_INTERVAL_MILLIS));
    map.put("fusion.iouThreshold", Double.toString(FusionSettings.DEFAULT_IOU_THRESHOLD));
    map.put("fusion.agreementBoost", Double.toString(FusionSettings.DEFAULT_AGREEMENT_BOOST));
    map.put("fusion.weight.onDeviceMultimodal", Double.toString(BackendTier.ON_DEVICE_MULTIMODAL.defaultWeight()));
    map.put("fusion.weight.remoteVision", Double.toString(BackendTier.REMOTE_VISION.defaultWeight()));
    map.put("fusion.weight.localDetector", Double.toString(BackendTier.LOCAL_DETECTOR.defaultWeight()));
    map.put("recommend.autoSelectThreshold", Double.toString(RecommendationSettings.DEFAULT_AUTO_SELECT_THRESHOLD));
    map.put("recommend.displayThreshold", Double.toString(RecommendationSettings.DEFAULT_DISPLAY_THRESHOLD));
    map.put("timeout.localMillis", Long.toString(OrchestratorSettings.DEFAULT_LOCAL_TIMEOUT_MILLIS));
    map.put("timeout.remoteMillis", Long.toString(OrchestratorSettings.DEFAULT_REMOTE_TIMEOUT_MILLIS));
    map.put("retry.timeoutFactor", Double.toString(OrchestratorSettings.DEFAULT_RETRY_TIMEOUT_FACTOR));
    map.put("health.windowSize", Integer.toString(HealthSettings.DEFAULT_WINDOW_SIZE));
    map.put("health.minSuccessRate", Double.toString(HealthSettings.DEFAULT_MIN_SUCCESS_RATE));
    map.put("health.minimumSamples", Integer.toString(HealthSettings.DEFAULT_MINIMUM_SAMPLES));
    map.put("health.deprioritizeMillis", Long.toString(HealthSettings.DEFAULT_DEPRIORITIZE_MILLIS));
    map.put("health.store", "");
    map.put("remote.id", RemoteSettings.DEFAULT_ID);
    map.put("remote.maxConcurrent", Integer.toString(OrchestratorSettings.DEFAULT_REMOTE_MAX_CONCURRENT));
    map.put("remote.endpoint", "");
    map.put("remote.apiKey", "");
    map.put("remote.requestTimeoutMillis", Long.toString(OrchestratorSettings.DEFAULT_REMOTE_TIMEOUT_MILLIS));
    map.put("hybrid.enabled", "false");
    map.put("batch.maxConcurrency", Integer.toString(OrchestratorSettings.DEFAULT_BATCH_CONCURRENCY));
    map.put("taxonomy.path", "");
    map.put("connectivity.quality", ConnectionQuality.GOOD.name());
    map.put("cache.maxEntries", Integer.toString(CacheSettings.DEFAULT_MAX_ENTRIES));
    map.put("cache.ttlMillis", Long.toString(CacheSettings.DEFAULT_TTL_MILLIS));
    return Map.copyOf(map);
  }

  /**
   * Builds a configuration from flat keys. Missing keys take their defaults.
   *
   * @param args flat key/value map
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static AnalysisConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> values = new LinkedHashMap<>(defaultsAsFlatMap());
    args.forEach((key, value) -> {
      if (value != null) {
        values.put(key, value);
      }
    });

    Map<BackendTier, Double> tierWeights = new EnumMap<>(BackendTier.class);
    tierWeights.put(BackendTier.ON_DEVICE_MULTIMODAL, parseDouble(values, "fusion.weight.onDeviceMultimodal"));
    tierWeights.put(BackendTier.REMOTE_VISION, parseDouble(values, "fusion.weight.remoteVision"));
    tierWeights.put(BackendTier.LOCAL_DETECTOR, parseDouble(values, "fusion.weight.localDetector"));
    FusionSettings fusion = new FusionSettings(
        parseDouble(values, "fusion.iouThreshold"),
        tierWeights,
        Map.of(),
        parseDouble(values, "fusion.agreementBoost"));

    RecommendationSettings recommendation = new RecommendationSettings(
        parseDouble(values, "recommend.autoSelectThreshold"),
        parseDouble(values, "recommend.displayThreshold"));

    HealthSettings health = new HealthSettings(
        parseInt(values, "health.windowSize"),
        parseDouble(values, "health.minSuccessRate"),
        parseInt(values, "health.minimumSamples"),
        parseLong(values, "health.deprioritizeMillis"));

    OrchestratorSettings orchestrator = new OrchestratorSettings(
        parseLong(values, "timeout.localMillis"),
        parseLong(values, "timeout.remoteMillis"),
        parseDouble(values, "retry.timeoutFactor"),
        parseInt(values, "remote.maxConcurrent"),
        parseBoolean(values, "hybrid.enabled"),
        parseInt(values, "batch.maxConcurrency"));

    RemoteSettings remote = new RemoteSettings(
        values.get("remote.id").trim(),
        parseEndpoint(values.get("remote.endpoint")),
        values.get("remote.apiKey").trim(),
        Numbers.requireRange("remote.requestTimeoutMillis", parseLong(values, "remote.requestTimeoutMillis"),
            1L, 600_000L));

    return new AnalysisConfig(
        parseLong(values, "throttle.minIntervalMillis"),
        fusion,
        recommendation,
        health,
        orchestrator,
        optionalPath(values.get("health.store"), "health.store"),
        remote,
        optionalPath(values.get("taxonomy.path"), "taxonomy.path"),
        parseQuality(values.get("connectivity.quality")),
        new CacheSettings(parseInt(values, "cache.maxEntries"), parseLong(values, "cache.ttlMillis")));
  }

  private static Optional<URI> parseEndpoint(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      URI uri = new URI(raw.trim());
      String scheme = uri.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("remote.endpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("remote.endpoint must include a host");
      }
      return Optional.of(uri);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("remote.endpoint must be a valid URI", ex);
    }
  }

  private static Optional<Path> optionalPath(String raw, String key) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(raw.trim()));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static ConnectionQuality parseQuality(String raw) {
    try {
      return ConnectionQuality.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("connectivity.quality must be one of "
          + Arrays.toString(ConnectionQuality.values()) + " (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(Map<String, String> values, String key) {
    String raw = values.get(key).trim();
    try {
      double value = Double.parseDouble(raw);
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException(key + " must be finite (was " + raw + ")");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static long parseLong(Map<String, String> values, String key) {
    String raw = values.get(key).trim();
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static int parseInt(Map<String, String> values, String key) {
    long value = parseLong(values, key);
    return (int) Numbers.requireRange(key, value, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  private static boolean parseBoolean(Map<String, String> values, String key) {
    String raw = values.get(key).trim().toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  /**
   * Remote vision adapter settings.
   *
   * @param id backend id used in metrics and health
   * @param endpoint analysis endpoint; empty when remote analysis is not configured
   * @param apiKey bearer token; blank when not configured
   * @param requestTimeoutMillis HTTP request timeout
   */
  public record RemoteSettings(String id, Optional<URI> endpoint, String apiKey, long requestTimeoutMillis) {
    static final String DEFAULT_ID = "remote-vision";

    public RemoteSettings {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(endpoint, "endpoint");
      apiKey = apiKey == null ? "" : apiKey;
    }

    public boolean configured() {
      return endpoint.isPresent() && !apiKey.isBlank();
    }

    @Override
    public String toString() {
      return "RemoteSettings[id=" + id + ", endpoint=" + endpoint.map(URI::toString).orElse("<unset>")
          + ", apiKey=" + Logs.redact(apiKey)
          + ", requestTimeoutMillis=" + requestTimeoutMillis + "]";
    }
  }
}
