package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.application.port.RawDetection;
import ca.siteguard.domain.backend.BackendFailure;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.logging.Logs;
import ca.siteguard.validation.Strings;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Backend that posts images to a remote vision service over HTTPS.
 * <p><strong>Why:</strong> The remote model is the most accurate tier when connectivity allows and the project
 * has credentials.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link AnalyzerBackend} with the JDK
 * {@link HttpClient} and a Jackson streaming codec.</p>
 * <p><strong>Failure mapping:</strong>
 * <ul>
 *   <li>401/403: {@code REMOTE_UNAUTHORIZED}; the backend reports unavailable until restarted.</li>
 *   <li>429: {@code REMOTE_RATE_LIMITED}.</li>
 *   <li>400/413/415/422: {@code MALFORMED_INPUT}.</li>
 *   <li>5xx and I/O errors: {@code TRANSIENT_NETWORK}; request timeouts: {@code TIMEOUT}.</li>
 *   <li>Unparseable bodies and other statuses: {@code ENGINE_ERROR}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; {@link HttpClient} is thread-safe.</p>
 * <p><strong>Security:</strong> The API key is sent as a bearer token and never logged.</p>
 *
 * @since SiteGuard 0.1
 */
public final class RemoteVisionBackend implements AnalyzerBackend {
  private static final Logger log = LoggerFactory.getLogger(RemoteVisionBackend.class);
  private static final int BODY_LOG_MAX_BYTES = 512;
  private static final Set<HazardCategory> CAPABILITIES =
      Set.copyOf(EnumSet.allOf(HazardCategory.class));

  private final String id;
  private final HttpClient client;
  private final URI endpoint;
  private final String apiKey;
  private final Duration requestTimeout;
  private final RemoteVisionCodec codec = new RemoteVisionCodec();
  private final DetectionMapper mapper;
  private final AtomicBoolean unauthorized = new AtomicBoolean();

  /**
   * Creates the adapter.
   *
   * @param id backend id
   * @param client shared HTTP client
   * @param endpoint analysis endpoint; {@code null} when not configured
   * @param apiKey bearer token; {@code null} or blank when not configured
   * @param requestTimeout per-request HTTP timeout
   * @param taxonomy label alias source
   * @param metrics metrics sink
   * @param clock detection timestamp source
   */
  public RemoteVisionBackend(
      String id,
      HttpClient client,
      URI endpoint,
      String apiKey,
      Duration requestTimeout,
      HazardTaxonomy taxonomy,
      MetricsPort metrics,
      ClockPort clock) {
    this.id = Strings.requireIdentifier("backend id", id);
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = endpoint;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.mapper = new DetectionMapper(this.id, taxonomy, 0d, metrics, clock);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public BackendTier tier() {
    return BackendTier.REMOTE_VISION;
  }

  @Override
  public CostClass costClass() {
    return CostClass.REMOTE_METERED;
  }

  @Override
  public Set<HazardCategory> capabilities() {
    return CAPABILITIES;
  }

  @Override
  public boolean available() {
    return configured() && !unauthorized.get();
  }

  boolean configured() {
    return endpoint != null && !apiKey.isEmpty();
  }

  @Override
  public BackendOutcome analyze(AnalysisImage image, AnalysisContext context) {
    long startNanos = System.nanoTime();
    if (!configured()) {
      return failure(BackendFailureKind.REMOTE_UNAUTHORIZED, "remote endpoint or API key not configured",
          startNanos);
    }
    if (unauthorized.get()) {
      return failure(BackendFailureKind.REMOTE_UNAUTHORIZED, "credentials previously rejected", startNanos);
    }
    if (image.isEmpty()) {
      return failure(BackendFailureKind.MALFORMED_INPUT, "image payload is empty", startNanos);
    }

    HttpResponse<String> response;
    try {
      HttpRequest request = HttpRequest.newBuilder(endpoint)
          .timeout(requestTimeout)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .header("Authorization", "Bearer " + apiKey)
          .POST(HttpRequest.BodyPublishers.ofByteArray(codec.encodeRequest(image, context)))
          .build();
      response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException ex) {
      return failure(BackendFailureKind.TIMEOUT, "request timed out after " + requestTimeout.toMillis() + " ms",
          startNanos);
    } catch (IOException ex) {
      return failure(BackendFailureKind.TRANSIENT_NETWORK, ex.toString(), startNanos);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failure(BackendFailureKind.CANCELLED, "request interrupted", startNanos);
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return decode(response.body(), image, startNanos);
    }
    String body = Logs.truncate(response.body(), BODY_LOG_MAX_BYTES);
    BackendFailureKind kind = classify(status);
    if (kind == BackendFailureKind.REMOTE_UNAUTHORIZED && unauthorized.compareAndSet(false, true)) {
      log.warn("Remote backend {} rejected credentials (HTTP {}); disabling until restart", id, status);
    }
    return failure(kind, "HTTP " + status + ": " + body, startNanos);
  }

  static BackendFailureKind classify(int status) {
    return switch (status) {
      case 401, 403 -> BackendFailureKind.REMOTE_UNAUTHORIZED;
      case 429 -> BackendFailureKind.REMOTE_RATE_LIMITED;
      case 400, 413, 415, 422 -> BackendFailureKind.MALFORMED_INPUT;
      default -> status >= 500 && status < 600
          ? BackendFailureKind.TRANSIENT_NETWORK
          : BackendFailureKind.ENGINE_ERROR;
    };
  }

  private BackendOutcome decode(String body, AnalysisImage image, long startNanos) {
    List<RawDetection> raw;
    try {
      raw = codec.decodeResponse(body);
    } catch (IOException | IllegalArgumentException ex) {
      log.debug("Unparseable response from {}: {}", id, Logs.truncate(body, BODY_LOG_MAX_BYTES));
      return failure(BackendFailureKind.ENGINE_ERROR, "unparseable response: " + ex.getMessage(), startNanos);
    }
    return BackendOutcome.success(id, tier(), mapper.map(raw, image), elapsedMillis(startNanos));
  }

  private BackendOutcome failure(BackendFailureKind kind, String detail, long startNanos) {
    return BackendOutcome.failure(id, tier(), BackendFailure.of(kind, detail), elapsedMillis(startNanos));
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
