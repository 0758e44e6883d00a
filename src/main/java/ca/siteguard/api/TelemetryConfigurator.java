package ca.siteguard.api;

import ca.siteguard.infrastructure.metrics.TelemetrySettings;
import ca.siteguard.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves metrics exporter settings from CLI keys, falling back to {@code otel.*} system properties and
 * {@code OTEL_*} environment variables.
 *
 * <p>Consumed keys are removed from the argument map: {@code metricsExporter}, {@code otelEndpoint} and
 * {@code otelResourceAttributes}.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings resolve(Map<String, String> args) {
    TelemetrySettings base = TelemetrySettings.fromSystem();
    String exporter = args.remove("metricsExporter");
    String endpoint = args.remove("otelEndpoint");
    String attributes = args.remove("otelResourceAttributes");

    TelemetrySettings.ExporterMode mode = base.exporter();
    if (exporter != null) {
      mode = TelemetrySettings.ExporterMode.from(exporter);
      log.debug("Metrics exporter set from CLI: {}", mode);
    }
    String resolvedEndpoint = base.endpoint();
    if (endpoint != null) {
      validateEndpoint(endpoint);
      resolvedEndpoint = endpoint;
    }
    String resolvedAttributes = base.resourceAttributes();
    if (attributes != null) {
      resolvedAttributes =
          Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return new TelemetrySettings(mode, resolvedEndpoint, base.exportInterval(), resolvedAttributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
