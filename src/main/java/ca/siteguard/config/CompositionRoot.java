package ca.siteguard.config;

import ca.siteguard.application.analysis.AnalysisResultCache;
import ca.siteguard.application.analysis.AnalysisThrottler;
import ca.siteguard.application.analysis.BackendHealthRegistry;
import ca.siteguard.application.analysis.ResultFusionEngine;
import ca.siteguard.application.analysis.SmartAnalysisOrchestrator;
import ca.siteguard.application.analysis.TagRecommendationEngine;
import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.BackendHealthStore;
import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.ConnectivityMonitor;
import ca.siteguard.application.port.InferenceEngine;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.infrastructure.backend.LightweightDetectorBackend;
import ca.siteguard.infrastructure.backend.OnDeviceMultimodalBackend;
import ca.siteguard.infrastructure.backend.RemoteVisionBackend;
import ca.siteguard.infrastructure.health.JsonFileBackendHealthStore;
import ca.siteguard.infrastructure.taxonomy.YamlHazardTaxonomyLoader;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the analysis orchestrator, engines and adapters from an {@link AnalysisConfig}.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI and embedding hosts build identical graphs.</p>
 * <p><strong>Role:</strong> Composition root spanning taxonomy, backends, fusion, recommendation and health.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the taxonomy from {@code taxonomy.path} or the bundled resource, once.</li>
 *   <li>Build the remote adapter when an endpoint and key are configured.</li>
 *   <li>Wrap host-supplied inference engines in local backends.</li>
 *   <li>Assemble a {@link SmartAnalysisOrchestrator} with shared health and persistence.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup use.</p>
 *
 * @since SiteGuard 0.1
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AnalysisConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private HazardTaxonomy taxonomy;

  /**
   * Creates a composition root.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   * @param clock time source shared by every component
   */
  public CompositionRoot(AnalysisConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public AnalysisConfig config() {
    return config;
  }

  /**
   * Loads the configured taxonomy on first use.
   *
   * @return taxonomy
   * @throws IOException when the taxonomy file or resource cannot be read
   */
  public HazardTaxonomy taxonomy() throws IOException {
    if (taxonomy == null) {
      YamlHazardTaxonomyLoader loader = new YamlHazardTaxonomyLoader();
      Optional<Path> path = config.taxonomyPath();
      taxonomy = path.isPresent() ? loader.load(path.get()) : loader.loadDefault();
    }
    return taxonomy;
  }

  /**
   * Returns the configured health store, or {@link BackendHealthStore#NO_OP} when persistence is off.
   *
   * @return health store
   */
  public BackendHealthStore healthStore() {
    return config.healthStore()
        .<BackendHealthStore>map(JsonFileBackendHealthStore::new)
        .orElse(BackendHealthStore.NO_OP);
  }

  /**
   * Builds the remote adapter when it is configured.
   *
   * @return remote backend, or empty without endpoint and key
   * @throws IOException when the taxonomy cannot be loaded
   */
  public Optional<AnalyzerBackend> remoteBackend() throws IOException {
    AnalysisConfig.RemoteSettings remote = config.remote();
    if (!remote.configured()) {
      log.info("Remote vision backend not configured; running with local backends only");
      return Optional.empty();
    }
    Duration timeout = Duration.ofMillis(remote.requestTimeoutMillis());
    HttpClient client = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .version(HttpClient.Version.HTTP_1_1)
        .build();
    log.info("Remote vision backend {} targeting {}", remote.id(), remote.endpoint().get());
    return Optional.of(new RemoteVisionBackend(
        remote.id(), client, remote.endpoint().get(), remote.apiKey(), timeout, taxonomy(), metrics, clock));
  }

  /**
   * Wraps an on-device multimodal engine.
   *
   * @param id backend id
   * @param engine host-supplied engine
   * @return backend
   * @throws IOException when the taxonomy cannot be loaded
   */
  public AnalyzerBackend onDeviceMultimodal(String id, InferenceEngine engine) throws IOException {
    return new OnDeviceMultimodalBackend(id, engine, taxonomy(), metrics, clock);
  }

  /**
   * Wraps a lightweight object detector engine.
   *
   * @param id backend id
   * @param engine host-supplied engine
   * @return backend
   * @throws IOException when the taxonomy cannot be loaded
   */
  public AnalyzerBackend lightweightDetector(String id, InferenceEngine engine) throws IOException {
    return new LightweightDetectorBackend(id, engine, taxonomy(), metrics, clock);
  }

  /**
   * Builds an orchestrator over the supplied local backends plus the configured remote backend.
   *
   * @param localBackends backends built from host engines; may be empty
   * @param connectivity network quality source
   * @return orchestrator; the caller owns and must close it
   * @throws IOException when the taxonomy cannot be loaded
   */
  public SmartAnalysisOrchestrator orchestrator(List<AnalyzerBackend> localBackends, ConnectivityMonitor connectivity)
      throws IOException {
    List<AnalyzerBackend> backends = new ArrayList<>(localBackends);
    remoteBackend().ifPresent(backends::add);
    HazardTaxonomy resolved = taxonomy();
    return new SmartAnalysisOrchestrator(
        backends,
        connectivity,
        new AnalysisThrottler(config.throttleMinIntervalMillis(), clock, metrics),
        new ResultFusionEngine(config.fusion(), resolved, metrics),
        new TagRecommendationEngine(resolved, config.recommendation(), metrics),
        new BackendHealthRegistry(config.health(), clock),
        healthStore(),
        config.orchestrator(),
        metrics,
        clock,
        new AnalysisResultCache(config.cache(), clock));
  }
}
