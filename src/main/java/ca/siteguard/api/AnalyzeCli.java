package ca.siteguard.api;

import ca.siteguard.application.analysis.SmartAnalysisOrchestrator;
import ca.siteguard.application.port.ClockPort;
import ca.siteguard.config.AnalysisConfig;
import ca.siteguard.config.CompositionRoot;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.image.CaptureMetadata;
import ca.siteguard.domain.image.GeoLocation;
import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.tag.TagRecommendation;
import ca.siteguard.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.siteguard.infrastructure.metrics.TelemetrySettings;
import ca.siteguard.infrastructure.time.SystemClockAdapter;
import ca.siteguard.logging.LoggingConfigurator;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code analyze} command: runs one photo session and prints hazards and recommendations.
 * <p><strong>Role:</strong> CLI adapter over {@link SmartAnalysisOrchestrator}. Only the configured remote backend is
 * available from the command line; on-device engines are supplied by embedding hosts.</p>
 *
 * @since SiteGuard 0.1
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: analyze image=PATH [workType=TEXT] [recallPriority=true|false] [width=PX height=PX] "
          + "[lat=DEG lon=DEG] [config=PATH] [profile=NAME] [key=value...]";
  private static final String HELP_TEXT = """
      SiteGuard photo analysis

      Usage:
        analyze image=PATH [options]

      Image options:
        image=PATH                 Photo to analyze (required)
        width=PX height=PX         Dimensions when the format cannot be decoded locally
        lat=DEG lon=DEG            Capture location
        workType=TEXT              Work being performed, passed to the backends
        recallPriority=true|false  Prefer recall: run local and remote backends together when online

      Configuration:
        config=PATH                YAML file with a common section and profile sections
        profile=NAME               Profile section to apply (default field)
        remote.endpoint=URL        Remote vision endpoint
        remote.apiKey=KEY          Remote vision API key
        connectivity.quality=Q     OFFLINE|POOR|FAIR|GOOD|EXCELLENT (default GOOD)
        metricsExporter=otlp|none  Metrics exporter
        Any other analysis key, for example recommend.autoSelectThreshold=0.85

      Flags:
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private AnalyzeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    Map<String, String> kv;
    ImageRequest request;
    TelemetrySettings telemetry;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      request = ImageRequest.extract(kv);
      telemetry = TelemetryConfigurator.resolve(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    AnalysisConfig config;
    try {
      config = ConfigCliUtils.loadConfig(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analysis configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }
    if (!config.remote().configured()) {
      log.error("analyze requires remote.endpoint and remote.apiKey");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    AnalysisImage image;
    try {
      image = request.load();
    } catch (IllegalArgumentException ex) {
      log.error("Unusable image {}: {}", request.path(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read image {}", request.path(), ex);
      return ExitCode.IO_ERROR;
    }

    ClockPort clock = new SystemClockAdapter();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      CompositionRoot root = new CompositionRoot(config, metrics, clock);
      try (SmartAnalysisOrchestrator orchestrator =
          root.orchestrator(List.of(), config::connectivity)) {
        AnalysisSession session = orchestrator.submitPhoto(image, request.context());
        print(session);
        return session.isComplete() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
      }
    } catch (IOException ex) {
      log.error("Unable to load hazard taxonomy", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid hazard taxonomy: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure during analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void print(AnalysisSession session) {
    CliPrinter.Report report = CliPrinter.report()
        .line("Session " + session.correlationId() + ": " + session.state()
            + " (" + session.latencyMillis() + " ms" + (session.degradedCapability() ? ", degraded" : "") + ")")
        .field("Backends tried", session.backendChain())
        .field("Backends reporting", session.contributingBackends());
    session.failureIfAny().ifPresent(failure -> report
        .field("Failure", failure.kind())
        .line(" " + failure.userMessage()));
    if (session.isComplete()) {
      report
          .section("Hazards", session.fusedHazards(), (FusedHazard hazard) -> String.format(Locale.ROOT,
              "%-28s %.2f %-8s %s",
              hazard.type().code(), hazard.confidence(), hazard.severity(), hazard.contributingBackends()))
          .section("Recommended tags", session.recommendations(), (TagRecommendation recommendation) ->
              String.format(Locale.ROOT, "%s %-32s %.2f %s",
                  recommendation.autoSelected() ? "[x]" : "[ ]",
                  recommendation.tagId(),
                  recommendation.confidence(),
                  recommendation.tag().displayName()));
    }
    report.print();
  }

  /** Image-specific arguments removed from the CLI map before configuration merging. */
  record ImageRequest(Path path, Integer width, Integer height, GeoLocation location, AnalysisContext context) {

    static ImageRequest extract(Map<String, String> kv) {
      String image = kv.remove("image");
      if (image == null) {
        throw new IllegalArgumentException("image=PATH is required");
      }
      Integer width = optionalInt(kv.remove("width"), "width");
      Integer height = optionalInt(kv.remove("height"), "height");
      if ((width == null) != (height == null)) {
        throw new IllegalArgumentException("width and height must be given together");
      }
      String lat = kv.remove("lat");
      String lon = kv.remove("lon");
      GeoLocation location = null;
      if (lat != null || lon != null) {
        if (lat == null || lon == null) {
          throw new IllegalArgumentException("lat and lon must be given together");
        }
        location = new GeoLocation(parseDouble(lat, "lat"), parseDouble(lon, "lon"), 0d);
      }
      String workType = kv.remove("workType");
      boolean recall = ConfigCliUtils.parseBoolean(kv.remove("recallPriority"), false);
      AnalysisContext context = new AnalysisContext(workType == null ? "" : workType, recall, Map.of());
      return new ImageRequest(Path.of(image), width, height, location, context);
    }

    AnalysisImage load() throws IOException {
      byte[] bytes = Files.readAllBytes(path);
      int w;
      int h;
      if (width != null) {
        w = width;
        h = height;
      } else {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        if (decoded == null) {
          throw new IllegalArgumentException("unsupported image format; pass width= and height=");
        }
        w = decoded.getWidth();
        h = decoded.getHeight();
      }
      Instant capturedAt = Files.getLastModifiedTime(path).toInstant();
      return new AnalysisImage(bytes, w, h, new CaptureMetadata(capturedAt, location));
    }

    private static Integer optionalInt(String raw, String key) {
      if (raw == null) {
        return null;
      }
      try {
        return Integer.valueOf(raw.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
      }
    }

    private static double parseDouble(String raw, String key) {
      try {
        return Double.parseDouble(raw.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
      }
    }
  }
}
