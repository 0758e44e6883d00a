package ca.siteguard.infrastructure.metrics;

import ca.siteguard.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records SiteGuard counters and histograms through OpenTelemetry.
 * <p><strong>Naming:</strong> Dotted keys such as {@code analysis.backend.remote.failure.timeout} become instrument
 * names after sanitizing; the original key is kept as the {@code siteguard.metric.key} attribute. Keys ending in
 * {@code latencyMillis} get unit {@code ms}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created once per key in concurrent maps.</p>
 *
 * @since SiteGuard 0.1
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("siteguard.metric.key");
  private static final String FALLBACK_METRIC_NAME = "siteguard.metric";
  private static final String LATENCY_SUFFIX = "latencymillis";

  private final OpenTelemetryBootstrap.Handle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  /**
   * Creates an adapter that feeds a caller-owned reader, such as an in-memory reader in tests.
   *
   * @param reader metric reader to register
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forReader(reader));
  }

  private OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
    if (handle.isNoop()) {
      log.info("Metrics adapter running without an exporter");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.close();
  }

  private Counter createCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("SiteGuard counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(name.endsWith(LATENCY_SUFFIX) ? "ms" : "1")
        .setDescription("SiteGuard observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
