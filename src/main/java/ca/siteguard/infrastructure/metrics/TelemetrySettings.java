package ca.siteguard.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Exporter settings for the OpenTelemetry meter provider.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic reader interval
 * @param resourceAttributes raw {@code key=value,key=value} resource attributes; may be blank
 * @since SiteGuard 0.1
 */
public record TelemetrySettings(
    ExporterMode exporter, String endpoint, Duration exportInterval, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Settings that export nothing. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, DEFAULT_ENDPOINT, DEFAULT_INTERVAL, "");
  }

  /**
   * Reads {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
   * {@code otel.resource.attributes} from system properties, then the matching {@code OTEL_*} environment
   * variables.
   *
   * @return resolved settings; exporter defaults to {@code otlp}
   */
  public static TelemetrySettings fromSystem() {
    Properties props = System.getProperties();
    String exporter = firstNonBlank(props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"));
    String endpoint =
        firstNonBlank(props.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String attributes =
        firstNonBlank(props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"));
    return new TelemetrySettings(ExporterMode.from(exporter), endpoint, DEFAULT_INTERVAL, attributes);
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }

  /** Supported exporters. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name; blank values select {@link #OTLP}.
     *
     * @param raw exporter name
     * @return exporter mode
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("Unsupported metrics exporter: " + raw);
      };
    }
  }
}
