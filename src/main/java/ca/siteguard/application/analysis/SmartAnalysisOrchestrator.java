package ca.siteguard.application.analysis;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.BackendHealthStore;
import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.ConnectionQuality;
import ca.siteguard.application.port.ConnectivityMonitor;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.domain.backend.BackendFailure;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.session.AnalysisErrorKind;
import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.session.SessionFailure;
import ca.siteguard.domain.session.SessionState;
import ca.siteguard.domain.session.SubmissionKind;
import ca.siteguard.infrastructure.exec.ExecutorFactories;
import ca.siteguard.logging.Logs;
import ca.siteguard.validation.Numbers;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Top-level coordinator that turns an image into an {@link AnalysisSession}.
 * <p><strong>Why:</strong> Backend availability, latency and cost vary per device and per moment; a single
 * coordinator chooses backends, applies retry and fallback, fuses results and recommends tags while keeping each
 * session's state consistent.</p>
 * <p><strong>Role:</strong> Application service composed by {@code CompositionRoot}; the only entry point used by
 * capture and live-preview callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk the session state machine {@code IDLE -> SELECTING_BACKENDS -> ANALYZING -> FUSING -> RECOMMENDING
 *   -> COMPLETE | FAILED}.</li>
 *   <li>Build the backend chain from availability, connectivity and {@link BackendHealthRegistry} state.</li>
 *   <li>Run the chain sequentially, or a local and a remote backend together in hybrid mode.</li>
 *   <li>Retry remote timeouts and transient network failures once with a shorter deadline; schedule background
 *   model reloads after local model-load failures.</li>
 *   <li>Serialize on-device inference through {@link LocalInferenceSlot} and cap remote fan-out. Time spent
 *   waiting for either counts against the call's timeout.</li>
 *   <li>Serve identical photo resubmissions from {@link AnalysisResultCache}.</li>
 *   <li>Let photos preempt in-flight frame sessions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent submissions. Each session runs on its own session thread;
 * each backend call runs as a separate task on the backend executor.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code analysisSession}; emits {@code analysis.session.*} and
 * {@code analysis.backend.<id>.*} metrics, plus {@code analysis.cache.hit} and {@code analysis.cache.miss} for
 * photos when caching is enabled.</p>
 *
 * @since SiteGuard 0.1
 */
public final class SmartAnalysisOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SmartAnalysisOrchestrator.class);

  /** MDC key carrying the session correlation id. */
  public static final String MDC_SESSION = "analysisSession";

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int DETAIL_MAX_BYTES = 256;

  private final List<AnalyzerBackend> backends;
  private final Map<String, AnalyzerBackend> backendsById;
  private final BackendSelector selector;
  private final ConnectivityMonitor connectivity;
  private final AnalysisThrottler throttler;
  private final ResultFusionEngine fusion;
  private final TagRecommendationEngine recommender;
  private final BackendHealthRegistry health;
  private final BackendHealthStore healthStore;
  private final OrchestratorSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final LocalInferenceSlot localSlot;
  private final Semaphore remotePermits;
  private final ExecutorService sessionExecutor;
  private final ExecutorService backendExecutor;
  private final ExecutorService reloadExecutor;
  private final ModelReloadScheduler reloads;
  private final AnalysisResultCache resultCache;
  private final ConcurrentHashMap<String, ActiveSession> activeSessions = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Wires the orchestrator and seeds backend health from the store.
   *
   * @param backends registered backends; ids must be unique
   * @param connectivity network quality source, checked at the start of every session
   * @param throttler frame-rate gate for {@link #submitFrame}
   * @param fusion fusion engine
   * @param recommender recommendation engine
   * @param health shared health registry
   * @param healthStore persistence for health across restarts; use {@link BackendHealthStore#NO_OP} when unused
   * @param settings timeouts, retry and concurrency tunables
   * @param metrics metrics sink
   * @param clock time source for session timestamps and health windows
   * @throws IllegalArgumentException when backend ids collide
   */
  public SmartAnalysisOrchestrator(
      List<AnalyzerBackend> backends,
      ConnectivityMonitor connectivity,
      AnalysisThrottler throttler,
      ResultFusionEngine fusion,
      TagRecommendationEngine recommender,
      BackendHealthRegistry health,
      BackendHealthStore healthStore,
      OrchestratorSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this(backends, connectivity, throttler, fusion, recommender, health, healthStore, settings, metrics, clock,
        AnalysisResultCache.disabled());
  }

  /**
   * Wires the orchestrator with a photo-result cache.
   *
   * @param resultCache completed photo results reused for identical resubmissions
   * @throws IllegalArgumentException when backend ids collide
   * @see #SmartAnalysisOrchestrator(List, ConnectivityMonitor, AnalysisThrottler, ResultFusionEngine,
   *     TagRecommendationEngine, BackendHealthRegistry, BackendHealthStore, OrchestratorSettings, MetricsPort,
   *     ClockPort)
   */
  public SmartAnalysisOrchestrator(
      List<AnalyzerBackend> backends,
      ConnectivityMonitor connectivity,
      AnalysisThrottler throttler,
      ResultFusionEngine fusion,
      TagRecommendationEngine recommender,
      BackendHealthRegistry health,
      BackendHealthStore healthStore,
      OrchestratorSettings settings,
      MetricsPort metrics,
      ClockPort clock,
      AnalysisResultCache resultCache) {
    this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
    Map<String, AnalyzerBackend> byId = new LinkedHashMap<>();
    for (AnalyzerBackend backend : this.backends) {
      if (byId.putIfAbsent(backend.id(), backend) != null) {
        throw new IllegalArgumentException("Duplicate backend id: " + backend.id());
      }
    }
    this.backendsById = Map.copyOf(byId);
    this.connectivity = Objects.requireNonNull(connectivity, "connectivity");
    this.throttler = Objects.requireNonNull(throttler, "throttler");
    this.fusion = Objects.requireNonNull(fusion, "fusion");
    this.recommender = Objects.requireNonNull(recommender, "recommender");
    this.health = Objects.requireNonNull(health, "health");
    this.healthStore = Objects.requireNonNull(healthStore, "healthStore");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.resultCache = Objects.requireNonNull(resultCache, "resultCache");
    this.selector = new BackendSelector(this.backends, health);
    this.localSlot = new LocalInferenceSlot();
    this.remotePermits = new Semaphore(settings.remoteMaxConcurrent(), true);

    UncaughtExceptionHandler handler =
        (thread, ex) -> log.error("Uncaught failure on analysis thread {}", thread.getName(), ex);
    this.sessionExecutor = ExecutorFactories.newElasticPool("analysis-session", handler);
    this.backendExecutor = ExecutorFactories.newElasticPool("analysis-backend", handler);
    this.reloadExecutor = ExecutorFactories.newReloadPool("analysis-reload", handler);
    this.reloads = new ModelReloadScheduler(reloadExecutor, metrics);

    try {
      health.seed(healthStore.load());
    } catch (IOException ex) {
      log.warn("Could not load persisted backend health; starting with empty history", ex);
    }
  }

  /**
   * Analyzes a captured photo and blocks until the session is finalized.
   *
   * @param image captured image
   * @param context request hints
   * @return finalized session, COMPLETE or FAILED
   * @throws InterruptedException when the caller is interrupted; the session is cancelled
   */
  public AnalysisSession submitPhoto(AnalysisImage image, AnalysisContext context) throws InterruptedException {
    AnalysisHandle handle = submitPhotoAsync(image, context);
    try {
      return handle.await();
    } catch (InterruptedException ex) {
      handle.cancel();
      throw ex;
    }
  }

  /**
   * Starts analysis of a captured photo. Photos are never throttled and cancel in-flight frame sessions.
   *
   * @param image captured image
   * @param context request hints
   * @return handle to the running session
   * @throws IllegalStateException when the orchestrator is closed
   */
  public AnalysisHandle submitPhotoAsync(AnalysisImage image, AnalysisContext context) {
    throttler.tryAccept(SubmissionKind.PHOTO);
    preemptFrames();
    return start(image, context, SubmissionKind.PHOTO);
  }

  /**
   * Offers a live-preview frame for analysis.
   *
   * @param image frame
   * @param context request hints
   * @return handle to the running session, or empty when the throttler dropped the frame
   * @throws IllegalStateException when the orchestrator is closed
   */
  public Optional<AnalysisHandle> submitFrame(AnalysisImage image, AnalysisContext context) {
    ensureOpen();
    if (!throttler.tryAccept(SubmissionKind.FRAME)) {
      return Optional.empty();
    }
    return Optional.of(start(image, context, SubmissionKind.FRAME));
  }

  /**
   * Analyzes photos with the configured default concurrency.
   *
   * @param photos photos to analyze
   * @param context request hints applied to every photo
   * @return sessions in input order
   * @throws InterruptedException when interrupted; outstanding sessions are cancelled
   */
  public List<AnalysisSession> analyzeBatch(List<AnalysisImage> photos, AnalysisContext context)
      throws InterruptedException {
    return analyzeBatch(photos, context, settings.batchConcurrency());
  }

  /**
   * Analyzes photos with at most {@code maxConcurrency} sessions in flight.
   *
   * @param photos photos to analyze
   * @param context request hints applied to every photo
   * @param maxConcurrency maximum concurrent sessions; at least 1
   * @return sessions in input order
   * @throws InterruptedException when interrupted; outstanding sessions are cancelled
   */
  public List<AnalysisSession> analyzeBatch(
      List<AnalysisImage> photos, AnalysisContext context, int maxConcurrency) throws InterruptedException {
    Objects.requireNonNull(photos, "photos");
    Numbers.requireRange("maxConcurrency", maxConcurrency, 1, 64);
    Semaphore gate = new Semaphore(maxConcurrency);
    List<AnalysisHandle> handles = new ArrayList<>(photos.size());
    try {
      for (AnalysisImage photo : photos) {
        gate.acquire();
        AnalysisHandle handle;
        try {
          handle = submitPhotoAsync(photo, context);
        } catch (RuntimeException ex) {
          gate.release();
          throw ex;
        }
        handle.future().whenComplete((session, error) -> gate.release());
        handles.add(handle);
      }
      List<AnalysisSession> sessions = new ArrayList<>(handles.size());
      for (AnalysisHandle handle : handles) {
        sessions.add(handle.await());
      }
      return sessions;
    } catch (InterruptedException ex) {
      handles.forEach(AnalysisHandle::cancel);
      throw ex;
    }
  }

  /**
   * Reports availability and rolling health of every backend plus current connectivity.
   *
   * @return health report
   */
  public HealthReport performHealthCheck() {
    ConnectionQuality quality = currentQuality();
    long now = clock.nowMillis();
    List<HealthReport.BackendStatus> statuses = new ArrayList<>(backends.size());
    for (AnalyzerBackend backend : backends) {
      BackendHealth snapshot = health.snapshot(backend.id());
      statuses.add(new HealthReport.BackendStatus(
          backend.id(),
          backend.tier(),
          backend.costClass(),
          backend.capabilities(),
          safeAvailable(backend),
          snapshot.successRate(),
          snapshot.averageLatencyMillis(),
          snapshot.sampleCount(),
          snapshot.isDeprioritized(now),
          snapshot.isDeprioritized(now) ? snapshot.deprioritizedUntilMillis() : 0L));
    }
    return new HealthReport(Instant.ofEpochMilli(now), quality, statuses);
  }

  /**
   * Cancels every in-flight session, typically when the owning UI context is torn down.
   *
   * @return number of sessions whose cancellation token was tripped by this call
   */
  public int cancelInFlight() {
    int cancelled = 0;
    for (ActiveSession session : activeSessions.values()) {
      if (session.token().cancel("owner closed")) {
        cancelled++;
      }
    }
    if (cancelled > 0) {
      log.info("Cancelled {} in-flight analysis sessions", cancelled);
    }
    return cancelled;
  }

  /**
   * Returns the number of sessions currently running.
   *
   * @return in-flight session count
   */
  public int inFlight() {
    return activeSessions.size();
  }

  /**
   * Returns how long the caller should wait before the next frame would be accepted.
   *
   * @return milliseconds until the throttler accepts another frame
   */
  public long millisUntilNextFrame() {
    return throttler.millisUntilNextFrame();
  }

  /**
   * Cancels in-flight sessions, persists backend health and stops the executors.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    cancelInFlight();
    shutdown(sessionExecutor, "session");
    shutdown(backendExecutor, "backend");
    reloadExecutor.shutdownNow();
    try {
      healthStore.save(health.toPersisted());
    } catch (IOException ex) {
      log.warn("Could not persist backend health", ex);
    }
  }

  LocalInferenceSlot localSlot() {
    return localSlot;
  }

  ModelReloadScheduler reloads() {
    return reloads;
  }

  AnalysisResultCache resultCache() {
    return resultCache;
  }

  private AnalysisHandle start(AnalysisImage image, AnalysisContext context, SubmissionKind kind) {
    Objects.requireNonNull(image, "image");
    Objects.requireNonNull(context, "context");
    ensureOpen();
    String correlationId = kind.name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
    CancellationToken token = new CancellationToken();
    CompletableFuture<AnalysisSession> result = new CompletableFuture<>();
    activeSessions.put(correlationId, new ActiveSession(kind, token));
    try {
      sessionExecutor.execute(() -> {
        try {
          result.complete(runSession(correlationId, kind, image, context, token));
        } catch (RuntimeException | Error ex) {
          log.error("Analysis session {} aborted", correlationId, ex);
          result.completeExceptionally(ex);
        } finally {
          activeSessions.remove(correlationId);
        }
      });
    } catch (RejectedExecutionException ex) {
      activeSessions.remove(correlationId);
      throw new IllegalStateException("orchestrator is closed", ex);
    }
    return new AnalysisHandle(correlationId, kind, result, token);
  }

  private void preemptFrames() {
    for (ActiveSession session : activeSessions.values()) {
      if (session.kind() == SubmissionKind.FRAME && session.token().cancel("preempted by photo")) {
        metrics.increment("analysis.session.preempted");
      }
    }
  }

  private AnalysisSession runSession(
      String correlationId,
      SubmissionKind kind,
      AnalysisImage image,
      AnalysisContext context,
      CancellationToken token) {
    MDC.put(MDC_SESSION, correlationId);
    SessionTracker tracker = new SessionTracker(correlationId, kind, clock.nowMillis());
    metrics.increment("analysis.session.started");
    try {
      AnalysisSession session = execute(tracker, kind, image, context, token);
      if (session.isComplete()) {
        metrics.increment("analysis.session.completed");
        metrics.observe("analysis.session.latencyMillis", session.latencyMillis());
        log.info("Session complete: {} hazards, {} recommendations, backends={}, degraded={}, {} ms",
            session.fusedHazards().size(), session.recommendations().size(),
            session.contributingBackends(), session.degradedCapability(), session.latencyMillis());
      } else {
        SessionFailure failure = session.failure();
        metrics.increment("analysis.session.failed." + lower(failure.kind()));
        log.info("Session failed: {} ({})", failure.kind(), failure.detail());
      }
      return session;
    } finally {
      MDC.remove(MDC_SESSION);
    }
  }

  private AnalysisSession execute(
      SessionTracker tracker,
      SubmissionKind kind,
      AnalysisImage image,
      AnalysisContext context,
      CancellationToken token) {
    tracker.transition(SessionState.SELECTING_BACKENDS);
    AnalysisResultCache.Key cacheKey = null;
    if (kind == SubmissionKind.PHOTO && resultCache.enabled()) {
      cacheKey = AnalysisResultCache.keyFor(image, context);
      Optional<AnalysisResultCache.CachedAnalysis> cached = resultCache.lookup(cacheKey);
      if (cached.isPresent()) {
        return replay(tracker, cached.get());
      }
      metrics.increment("analysis.cache.miss");
    }
    ConnectionQuality quality = currentQuality();
    List<AnalyzerBackend> chain = selector.select(quality);
    if (token.isCancelled()) {
      return cancelled(tracker, token);
    }
    if (chain.isEmpty()) {
      return tracker.fail(
          SessionFailure.noBackendAvailable("no backend available (connectivity=" + quality + ")"),
          clock.nowMillis());
    }
    log.debug("Backend chain {} (connectivity={})", ids(chain), quality);

    tracker.transition(SessionState.ANALYZING);
    Call call = new Call(kind, image, context, token);
    StageResult stage;
    Optional<HybridPair> hybrid = hybridPair(chain, quality, context);
    if (hybrid.isPresent()) {
      stage = analyzeHybrid(hybrid.get(), chain, tracker, call);
    } else {
      stage = analyzeSequential(chain, Set.of(), tracker, call);
    }

    if (stage.cancelled() || token.isCancelled()) {
      return cancelled(tracker, token);
    }
    if (stage.malformed() != null) {
      return tracker.fail(SessionFailure.malformedInput(stage.malformed().failure().detail()), clock.nowMillis());
    }
    if (stage.successes().isEmpty()) {
      return tracker.fail(SessionFailure.noBackendAvailable(stage.lastFailure()), clock.nowMillis());
    }

    tracker.transition(SessionState.FUSING);
    List<DetectionBatch> batches = new ArrayList<>(stage.successes().size());
    for (BackendOutcome outcome : stage.successes()) {
      batches.add(DetectionBatch.from(outcome));
      tracker.contributed(outcome.backendId(), backendsById.get(outcome.backendId()).capabilities());
    }
    List<FusedHazard> fused = fusion.fuse(batches);
    tracker.fused(fused);
    if (token.isCancelled()) {
      return cancelled(tracker, token);
    }

    tracker.transition(SessionState.RECOMMENDING);
    tracker.recommended(recommender.recommend(fused));
    tracker.degraded(isDegraded(stage.successes()));
    if (token.isCancelled()) {
      return cancelled(tracker, token);
    }
    AnalysisSession session = tracker.complete(clock.nowMillis());
    if (cacheKey != null) {
      resultCache.store(cacheKey, session);
    }
    return session;
  }

  private AnalysisSession replay(SessionTracker tracker, AnalysisResultCache.CachedAnalysis cached) {
    metrics.increment("analysis.cache.hit");
    log.debug("Reusing cached result from {}", cached.contributingBackends());
    tracker.transition(SessionState.ANALYZING);
    for (String backendId : cached.contributingBackends()) {
      tracker.contributed(backendId, cached.coveredCategories());
    }
    tracker.transition(SessionState.FUSING);
    tracker.fused(cached.fusedHazards());
    tracker.transition(SessionState.RECOMMENDING);
    tracker.recommended(cached.recommendations());
    tracker.degraded(cached.degradedCapability());
    return tracker.complete(clock.nowMillis());
  }

  private Optional<HybridPair> hybridPair(
      List<AnalyzerBackend> chain, ConnectionQuality quality, AnalysisContext context) {
    if (!(settings.hybridEnabled() || context.recallPriority()) || !quality.supportsHybrid()) {
      return Optional.empty();
    }
    AnalyzerBackend local = null;
    AnalyzerBackend remote = null;
    for (AnalyzerBackend backend : chain) {
      if (backend.tier().local()) {
        local = local == null ? backend : local;
      } else {
        remote = remote == null ? backend : remote;
      }
    }
    if (local == null || remote == null) {
      return Optional.empty();
    }
    return Optional.of(new HybridPair(local, remote));
  }

  private StageResult analyzeSequential(
      List<AnalyzerBackend> chain, Set<String> skip, SessionTracker tracker, Call call) {
    String lastFailure = "every backend failed";
    for (AnalyzerBackend backend : chain) {
      if (skip.contains(backend.id())) {
        continue;
      }
      if (call.token().isCancelled()) {
        return StageResult.wasCancelled();
      }
      tracker.attempted(backend.id());
      BackendOutcome outcome = callWithRetry(backend, call);
      if (outcome.isSuccess()) {
        return StageResult.succeeded(List.of(outcome));
      }
      BackendFailureKind kind = outcome.failureKind();
      if (kind == BackendFailureKind.CANCELLED) {
        return StageResult.wasCancelled();
      }
      if (kind == BackendFailureKind.MALFORMED_INPUT) {
        return StageResult.malformedInput(outcome);
      }
      lastFailure = backend.id() + ": " + kind + " " + outcome.failure().detail();
      log.info("Falling back after {} failed with {}", backend.id(), kind);
    }
    return StageResult.noneSucceeded(lastFailure);
  }

  private StageResult analyzeHybrid(
      HybridPair pair, List<AnalyzerBackend> chain, SessionTracker tracker, Call call) {
    log.debug("Hybrid analysis with {} and {}", pair.local().id(), pair.remote().id());
    tracker.attempted(pair.local().id());
    tracker.attempted(pair.remote().id());
    PendingCall remoteCall = launch(pair.remote(), settings.timeoutFor(pair.remote().tier()), call);
    PendingCall localCall = launch(pair.local(), settings.timeoutFor(pair.local().tier()), call);

    BackendOutcome localOutcome = localCall.await();
    afterCall(pair.local(), localOutcome);
    BackendOutcome remoteOutcome = remoteCall.await();
    afterCall(pair.remote(), remoteOutcome);
    remoteOutcome = retryIfEligible(pair.remote(), remoteOutcome, call);

    List<BackendOutcome> outcomes = List.of(localOutcome, remoteOutcome);
    List<BackendOutcome> successes = new ArrayList<>(2);
    for (BackendOutcome outcome : outcomes) {
      if (outcome.isSuccess()) {
        successes.add(outcome);
      } else if (outcome.failureKind() == BackendFailureKind.CANCELLED) {
        return StageResult.wasCancelled();
      } else if (outcome.failureKind() == BackendFailureKind.MALFORMED_INPUT) {
        return StageResult.malformedInput(outcome);
      }
    }
    if (successes.size() == 1) {
      BackendOutcome failed = localOutcome.isSuccess() ? remoteOutcome : localOutcome;
      metrics.increment("analysis.session." + lower(AnalysisErrorKind.PARTIAL_FUSION_FAILURE));
      log.info("Hybrid backend {} failed with {}; fusing results from {} only",
          failed.backendId(), failed.failureKind(), successes.get(0).backendId());
    }
    if (!successes.isEmpty()) {
      return StageResult.succeeded(successes);
    }
    log.info("Both hybrid backends failed; continuing with the rest of the chain");
    Set<String> tried = new HashSet<>();
    tried.add(pair.local().id());
    tried.add(pair.remote().id());
    StageResult rest = analyzeSequential(chain, tried, tracker, call);
    if (rest.successes().isEmpty() && rest.malformed() == null && !rest.cancelled()) {
      return StageResult.noneSucceeded(remoteOutcome.backendId() + ": " + remoteOutcome.failureKind()
          + "; " + localOutcome.backendId() + ": " + localOutcome.failureKind());
    }
    return rest;
  }

  private BackendOutcome callWithRetry(AnalyzerBackend backend, Call call) {
    BackendOutcome outcome = launch(backend, settings.timeoutFor(backend.tier()), call).await();
    afterCall(backend, outcome);
    return retryIfEligible(backend, outcome, call);
  }

  private BackendOutcome retryIfEligible(AnalyzerBackend backend, BackendOutcome outcome, Call call) {
    if (outcome.isSuccess()
        || backend.tier().local()
        || !outcome.failureKind().retryable()
        || call.token().isCancelled()) {
      return outcome;
    }
    long retryTimeout = settings.retryTimeoutFor(backend.tier());
    metrics.increment(backendKey(backend.id(), "retry"));
    log.info("Retrying {} after {} with {} ms timeout", backend.id(), outcome.failureKind(), retryTimeout);
    BackendOutcome retried = launch(backend, retryTimeout, call).await();
    afterCall(backend, retried);
    return retried;
  }

  private void afterCall(AnalyzerBackend backend, BackendOutcome outcome) {
    String id = backend.id();
    if (outcome.failureKind() == BackendFailureKind.CANCELLED) {
      log.debug("Call to {} cancelled; not counted in health", id);
      return;
    }
    health.record(outcome);
    metrics.observe(backendKey(id, "latencyMillis"), outcome.latencyMillis());
    if (outcome.isSuccess()) {
      metrics.increment(backendKey(id, "success"));
      log.debug("Backend {} returned {} detections in {} ms", id, outcome.detections().size(),
          outcome.latencyMillis());
      return;
    }
    BackendFailure failure = outcome.failure();
    metrics.increment(backendKey(id, "failure." + lower(failure.kind())));
    log.info("Backend {} failed with {} after {} ms: {}", id, failure.kind(), outcome.latencyMillis(),
        failure.detail());
    if (failure.kind() == BackendFailureKind.MODEL_NOT_LOADED && backend.tier().local()) {
      reloads.schedule(backend);
    }
  }

  private PendingCall launch(AnalyzerBackend backend, long timeoutMillis, Call call) {
    long launchedNanos = System.nanoTime();
    Permit permit;
    try {
      permit = acquirePermit(backend, timeoutMillis, call);
    } catch (TimeoutException ex) {
      log.info("No {} capacity for {} within {} ms", backend.tier().local() ? "local" : "remote", backend.id(),
          timeoutMillis);
      return PendingCall.completed(BackendOutcome.failure(backend.id(), backend.tier(),
          BackendFailure.of(BackendFailureKind.TIMEOUT, ex.getMessage()), elapsedMillis(launchedNanos)));
    } catch (CancellationException ex) {
      return PendingCall.completed(cancelledOutcome(backend, "cancelled while waiting: " + ex.getMessage()));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      call.token().cancel("interrupted");
      return PendingCall.completed(cancelledOutcome(backend, "interrupted while waiting"));
    }

    AtomicBoolean started = new AtomicBoolean();
    String correlationId = MDC.get(MDC_SESSION);
    Future<BackendOutcome> future;
    try {
      future = backendExecutor.submit(() -> {
        if (!started.compareAndSet(false, true)) {
          return cancelledOutcome(backend, "abandoned before start");
        }
        if (correlationId != null) {
          MDC.put(MDC_SESSION, correlationId);
        }
        try (Permit held = permit) {
          return invoke(backend, call.image(), call.context());
        } finally {
          MDC.remove(MDC_SESSION);
        }
      });
    } catch (RejectedExecutionException ex) {
      permit.close();
      return PendingCall.completed(cancelledOutcome(backend, "backend executor rejected call"));
    }
    CancellationToken.Registration registration = call.token().onCancel(() -> future.cancel(true));
    return new PendingCall(
        backend, future, started, permit, registration, timeoutMillis, launchedNanos, call.token());
  }

  private Permit acquirePermit(AnalyzerBackend backend, long timeoutMillis, Call call)
      throws InterruptedException, TimeoutException {
    if (backend.tier().local()) {
      LocalInferenceSlot.Lease lease =
          localSlot.acquire(call.kind(), call.token(), timeoutMillis, TimeUnit.MILLISECONDS);
      return lease::close;
    }
    long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    while (!remotePermits.tryAcquire(LocalInferenceSlot.DEFAULT_CHECKPOINT_MILLIS, TimeUnit.MILLISECONDS)) {
      call.token().throwIfCancelled();
      if (System.nanoTime() - deadlineNanos >= 0L) {
        throw new TimeoutException(
            "remote capacity of " + settings.remoteMaxConcurrent() + " busy for " + timeoutMillis + " ms");
      }
    }
    AtomicBoolean released = new AtomicBoolean();
    return () -> {
      if (released.compareAndSet(false, true)) {
        remotePermits.release();
      }
    };
  }

  private BackendOutcome invoke(AnalyzerBackend backend, AnalysisImage image, AnalysisContext context) {
    long startNanos = System.nanoTime();
    try {
      BackendOutcome outcome = backend.analyze(image, context);
      if (outcome == null) {
        return BackendOutcome.failure(backend.id(), backend.tier(),
            BackendFailure.of(BackendFailureKind.ENGINE_ERROR, "backend returned no outcome"),
            elapsedMillis(startNanos));
      }
      return outcome;
    } catch (RuntimeException ex) {
      log.warn("Backend {} threw instead of returning a failure", backend.id(), ex);
      return BackendOutcome.failure(backend.id(), backend.tier(),
          BackendFailure.of(BackendFailureKind.ENGINE_ERROR, Logs.truncate(ex.toString(), DETAIL_MAX_BYTES)),
          elapsedMillis(startNanos));
    }
  }

  private AnalysisSession cancelled(SessionTracker tracker, CancellationToken token) {
    String reason = token.reason() == null ? "cancelled" : token.reason();
    return tracker.fail(SessionFailure.cancelled(reason), clock.nowMillis());
  }

  private static boolean isDegraded(List<BackendOutcome> successes) {
    for (BackendOutcome outcome : successes) {
      if (outcome.tier().capabilityRank() > BackendTier.LOCAL_DETECTOR.capabilityRank()) {
        return false;
      }
    }
    return true;
  }

  private ConnectionQuality currentQuality() {
    try {
      return Objects.requireNonNullElse(connectivity.quality(), ConnectionQuality.OFFLINE);
    } catch (RuntimeException ex) {
      log.warn("Connectivity check failed; assuming offline", ex);
      return ConnectionQuality.OFFLINE;
    }
  }

  private static boolean safeAvailable(AnalyzerBackend backend) {
    try {
      return backend.available();
    } catch (RuntimeException ex) {
      log.warn("Availability check for {} failed", backend.id(), ex);
      return false;
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("orchestrator is closed");
    }
  }

  private static void shutdown(ExecutorService executor, String name) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("{} executor did not terminate within {}; forcing shutdown", name, SHUTDOWN_TIMEOUT);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static BackendOutcome cancelledOutcome(AnalyzerBackend backend, String detail) {
    return BackendOutcome.failure(backend.id(), backend.tier(),
        BackendFailure.of(BackendFailureKind.CANCELLED, detail), 0L);
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static String backendKey(String backendId, String suffix) {
    return "analysis.backend." + backendId + "." + suffix;
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private static List<String> ids(List<AnalyzerBackend> chain) {
    List<String> ids = new ArrayList<>(chain.size());
    for (AnalyzerBackend backend : chain) {
      ids.add(backend.id());
    }
    return ids;
  }

  /** Exclusive resource held for the duration of one backend call. */
  @FunctionalInterface
  private interface Permit extends AutoCloseable {
    @Override
    void close();
  }

  private record ActiveSession(SubmissionKind kind, CancellationToken token) {}

  private record HybridPair(AnalyzerBackend local, AnalyzerBackend remote) {}

  private record Call(
      SubmissionKind kind, AnalysisImage image, AnalysisContext context, CancellationToken token) {}

  private record StageResult(
      List<BackendOutcome> successes, BackendOutcome malformed, boolean cancelled, String lastFailure) {
    static StageResult succeeded(List<BackendOutcome> successes) {
      return new StageResult(List.copyOf(successes), null, false, "");
    }

    static StageResult malformedInput(BackendOutcome outcome) {
      return new StageResult(List.of(), outcome, false, outcome.failure().detail());
    }

    static StageResult wasCancelled() {
      return new StageResult(List.of(), null, true, "cancelled");
    }

    static StageResult noneSucceeded(String lastFailure) {
      return new StageResult(List.of(), null, false, lastFailure);
    }
  }

  /** A launched backend call awaiting its result against a deadline that includes the wait for capacity. */
  private static final class PendingCall {
    private final AnalyzerBackend backend;
    private final Future<BackendOutcome> future;
    private final AtomicBoolean started;
    private final Permit permit;
    private final CancellationToken.Registration registration;
    private final long timeoutMillis;
    private final long launchedNanos;
    private final CancellationToken token;
    private final BackendOutcome completed;

    private PendingCall(
        AnalyzerBackend backend,
        Future<BackendOutcome> future,
        AtomicBoolean started,
        Permit permit,
        CancellationToken.Registration registration,
        long timeoutMillis,
        long launchedNanos,
        CancellationToken token) {
      this.backend = backend;
      this.future = future;
      this.started = started;
      this.permit = permit;
      this.registration = registration;
      this.timeoutMillis = timeoutMillis;
      this.launchedNanos = launchedNanos;
      this.token = token;
      this.completed = null;
    }

    private PendingCall(BackendOutcome completed) {
      this.backend = null;
      this.future = null;
      this.started = null;
      this.permit = null;
      this.registration = null;
      this.timeoutMillis = 0L;
      this.launchedNanos = 0L;
      this.token = null;
      this.completed = completed;
    }

    static PendingCall completed(BackendOutcome outcome) {
      return new PendingCall(outcome);
    }

    BackendOutcome await() {
      if (completed != null) {
        return completed;
      }
      long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis) - (System.nanoTime() - launchedNanos);
      try {
        return future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
      } catch (TimeoutException ex) {
        future.cancel(true);
        releaseIfNeverStarted();
        if (token.isCancelled()) {
          return cancelledOutcome(backend, "cancelled: " + token.reason());
        }
        return BackendOutcome.failure(backend.id(), backend.tier(),
            BackendFailure.of(BackendFailureKind.TIMEOUT, "no result within " + timeoutMillis + " ms"),
            elapsedMillis(launchedNanos));
      } catch (CancellationException ex) {
        releaseIfNeverStarted();
        return cancelledOutcome(backend, "cancelled: " + token.reason());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        return BackendOutcome.failure(backend.id(), backend.tier(),
            BackendFailure.of(BackendFailureKind.ENGINE_ERROR, Logs.truncate(cause.toString(), DETAIL_MAX_BYTES)),
            elapsedMillis(launchedNanos));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        token.cancel("interrupted");
        future.cancel(true);
        releaseIfNeverStarted();
        return cancelledOutcome(backend, "interrupted");
      } finally {
        registration.close();
      }
    }

    private void releaseIfNeverStarted() {
      if (started.compareAndSet(false, true)) {
        permit.close();
      }
    }
  }
}
