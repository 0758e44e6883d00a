package ca.siteguard.application.analysis;

import static ca.siteguard.application.analysis.AnalysisFixtures.DEBRIS;
import static ca.siteguard.application.analysis.AnalysisFixtures.FALL;
import static ca.siteguard.application.analysis.AnalysisFixtures.HARD_HAT;
import static ca.siteguard.application.analysis.AnalysisFixtures.LEFT;
import static ca.siteguard.application.analysis.AnalysisFixtures.LEFT_HALF_OVERLAP;
import static ca.siteguard.application.analysis.AnalysisFixtures.SAFETY_VEST;
import static ca.siteguard.application.analysis.AnalysisFixtures.image;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.siteguard.application.analysis.FakeBackend.Hit;
import ca.siteguard.application.analysis.FakeBackend.Step;
import ca.siteguard.application.port.BackendHealthStore;
import ca.siteguard.application.port.ConnectionQuality;
import ca.siteguard.application.port.ConnectivityMonitor;
import ca.siteguard.application.port.PersistedHealth;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.session.AnalysisErrorKind;
import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.session.SessionState;
import ca.siteguard.domain.session.SubmissionKind;
import ca.siteguard.domain.tag.RecommendationReason;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SmartAnalysisOrchestratorTest {
  private static final long AWAIT_SECONDS = 5L;

  private final ManualClock clock = new ManualClock(1_700_000_000_000L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private BackendHealthRegistry health =
      new BackendHealthRegistry(HealthSettings.defaults(), clock);
  private BackendHealthStore store = BackendHealthStore.NO_OP;
  private SmartAnalysisOrchestrator orchestrator;

  @AfterEach
  void tearDown() {
    if (orchestrator != null) {
      orchestrator.close();
    }
  }

  @Test
  void singleOnDeviceDetectionAutoSelectsHardHatTag() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.92d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(List.of(SessionState.IDLE, SessionState.SELECTING_BACKENDS, SessionState.ANALYZING,
        SessionState.FUSING, SessionState.RECOMMENDING, SessionState.COMPLETE), session.stateHistory());
    assertEquals(1, session.fusedHazards().size());
    assertEquals(0.92d, session.fusedHazards().get(0).confidence(), 1e-9);
    assertTrue(session.autoSelectTags().contains("ppe-hard-hat-required"));
    assertFalse(session.degradedCapability());
    assertEquals(List.of("on-device"), session.contributingBackends());
    assertTrue(session.correlationId().startsWith("photo-"));
    assertEquals(1, metrics.count("analysis.session.started"));
    assertEquals(1, metrics.count("analysis.session.completed"));
    assertEquals(1, metrics.count("analysis.backend.on-device.success"));
  }

  @Test
  void hybridAgreementIsBoostedButStaysSuggested() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.detects(new Hit(HARD_HAT, 0.60d, LEFT)));
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .respondWith(Step.detects(new Hit(HARD_HAT, 0.50d, LEFT_HALF_OVERLAP)));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(2_000L, 2_000L, true), onDevice, remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(1, session.fusedHazards().size());
    FusedHazard hazard = session.fusedHazards().get(0);
    assertEquals(0.60d, hazard.confidence(), 1e-9);
    assertEquals(List.of("on-device", "remote-vision"), hazard.contributingBackends());
    assertEquals(1, session.recommendations().size());
    assertEquals(RecommendationReason.SUGGESTED, session.recommendations().get(0).reason());
    assertTrue(session.autoSelectTags().isEmpty());
    assertEquals(1, onDevice.calls());
    assertEquals(1, remote.calls());
  }

  @Test
  void everyBackendUnavailableFailsWithManualTaggingMessage() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.fails(BackendFailureKind.ENGINE_ERROR));
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .respondWith(Step.fails(BackendFailureKind.REMOTE_UNAUTHORIZED));
    FakeBackend detector = FakeBackend.detector("detector")
        .respondWith(Step.fails(BackendFailureKind.MODEL_NOT_LOADED));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, remote, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.FAILED, session.state());
    assertEquals(AnalysisErrorKind.NO_BACKEND_AVAILABLE, session.failure().kind());
    assertTrue(session.failure().userMessage().contains("tag this photo manually"));
    assertEquals(List.of("on-device", "remote-vision", "detector"), session.backendChain());
    assertTrue(session.fusedHazards().isEmpty());
    assertTrue(session.recommendations().isEmpty());
    assertFalse(session.degradedCapability());
    assertEquals(1, remote.calls(), "unauthorized is not retried");
    assertEquals(1, metrics.count("analysis.session.failed.no_backend_available"));
  }

  @Test
  void hybridRemoteTimeoutStillCompletesFromLocalResults() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(
        Hit.of(HARD_HAT, 0.9d), Hit.of(FALL, 0.85d), Hit.of(DEBRIS, 0.5d)));
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(3_000L));
    orchestrator = build(() -> ConnectionQuality.EXCELLENT, settings(2_000L, 300L, true), onDevice, remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertFalse(session.degradedCapability());
    assertEquals(3, session.fusedHazards().size());
    assertEquals(List.of("on-device"), session.contributingBackends());
    assertEquals(2, remote.calls(), "timeout is retried once");
    assertEquals(1, metrics.count("analysis.backend.remote-vision.retry"));
    assertEquals(2, metrics.count("analysis.backend.remote-vision.failure.timeout"));
    assertEquals(1, metrics.count("analysis.session.partial_fusion_failure"));
    BackendHealth remoteHealth = health.snapshot("remote-vision");
    assertTrue(remoteHealth.successRate() < 1d);
    assertEquals(2, remoteHealth.sampleCount());
  }

  @Test
  void emptyDetectionsCompleteWithoutRecommendations() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects());
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertTrue(session.fusedHazards().isEmpty());
    assertTrue(session.recommendations().isEmpty());
    assertTrue(session.autoSelectTags().isEmpty());
  }

  @Test
  void localTimeoutFallsBackToDetectorAndMarksDegraded() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(3_000L));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(SAFETY_VEST, 0.7d)));
    orchestrator = build(() -> ConnectionQuality.OFFLINE, settings(200L, 2_000L, false), onDevice, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertTrue(session.degradedCapability());
    assertEquals(List.of("on-device", "detector"), session.backendChain());
    assertEquals(List.of("detector"), session.contributingBackends());
    assertEquals(1, onDevice.calls(), "local backends are not retried");
    assertEquals(1, metrics.count("analysis.backend.on-device.failure.timeout"));
    assertEquals(0, metrics.count("analysis.backend.on-device.retry"));
  }

  @Test
  void remoteRetryUsesReducedTimeout() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .thenRespond(Step.fails(BackendFailureKind.TRANSIENT_NETWORK))
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(800L));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(2_000L, 1_000L, false), remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.FAILED, session.state(), "retry must give up before the full timeout");
    assertEquals(AnalysisErrorKind.NO_BACKEND_AVAILABLE, session.failure().kind());
    assertEquals(2, remote.calls());
    assertEquals(1, metrics.count("analysis.backend.remote-vision.failure.transient_network"));
    assertEquals(1, metrics.count("analysis.backend.remote-vision.failure.timeout"));
  }

  @Test
  void remoteRetrySucceedsAfterTransientFailure() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .thenRespond(Step.fails(BackendFailureKind.TRANSIENT_NETWORK))
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(2, remote.calls());
    assertEquals(List.of("remote-vision"), session.contributingBackends());
  }

  @Test
  void malformedInputFailsWithoutFallback() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.fails(BackendFailureKind.MALFORMED_INPUT));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.FAILED, session.state());
    assertEquals(AnalysisErrorKind.MALFORMED_INPUT, session.failure().kind());
    assertTrue(session.failure().userMessage().toLowerCase().contains("retake"));
    assertEquals(0, detector.calls());
  }

  @Test
  void offlineWithOnlyRemoteBackendReportsNoBackendAvailable() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision");
    orchestrator = build(ConnectivityMonitor.OFFLINE, OrchestratorSettings.defaults(), remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.FAILED, session.state());
    assertEquals(AnalysisErrorKind.NO_BACKEND_AVAILABLE, session.failure().kind());
    assertEquals(List.of(SessionState.IDLE, SessionState.SELECTING_BACKENDS, SessionState.FAILED),
        session.stateHistory());
    assertTrue(session.backendChain().isEmpty());
    assertEquals(0, remote.calls());
  }

  @Test
  void offlineSkipsRemoteEvenWhenHybridRequested() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    FakeBackend remote = FakeBackend.remote("remote-vision");
    orchestrator = build(ConnectivityMonitor.OFFLINE, settings(2_000L, 2_000L, true), onDevice, remote);

    AnalysisSession session =
        orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT.withRecallPriority());

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(0, remote.calls());
  }

  @Test
  void unavailableBackendIsSkipped() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").unavailable();
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(List.of("detector"), session.backendChain());
    assertEquals(0, onDevice.calls());
  }

  @Test
  void recallPriorityRunsHybridWithoutGlobalSetting() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    FakeBackend remote = FakeBackend.remote("remote-vision").respondWith(Step.detects(Hit.of(FALL, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.FAIR, OrchestratorSettings.defaults(), onDevice, remote);

    AnalysisSession session =
        orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT.withRecallPriority());

    assertEquals(2, session.fusedHazards().size());
    assertEquals(List.of("on-device", "remote-vision"), session.contributingBackends());
  }

  @Test
  void poorConnectivityDisablesHybrid() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    FakeBackend remote = FakeBackend.remote("remote-vision").respondWith(Step.detects(Hit.of(FALL, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.POOR, settings(2_000L, 2_000L, true), onDevice, remote);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(List.of("on-device"), session.contributingBackends());
    assertEquals(0, remote.calls());
  }

  @Test
  void bothHybridBackendsFailingContinuesDownTheChain() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.fails(BackendFailureKind.ENGINE_ERROR));
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .respondWith(Step.fails(BackendFailureKind.REMOTE_RATE_LIMITED));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(2_000L, 2_000L, true), onDevice, remote, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertTrue(session.degradedCapability());
    assertEquals(List.of("detector"), session.contributingBackends());
    assertEquals(1, remote.calls(), "rate limiting is not retried");
    assertTrue(health.isDeprioritized("remote-vision"));
  }

  @Test
  void throwingBackendIsTreatedAsEngineError() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.throwing(new IllegalStateException("boom")));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    assertEquals(1, metrics.count("analysis.backend.on-device.failure.engine_error"));
  }

  @Test
  void cancellingHandleEndsSessionAsCancelled() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(10_000L));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(20_000L, 20_000L, false), onDevice);

    AnalysisHandle handle = orchestrator.submitPhotoAsync(image(), AnalysisContext.DEFAULT);
    assertTrue(onDevice.awaitEntered(1, 2_000L));
    assertTrue(handle.cancel());
    AnalysisSession session = handle.await(AWAIT_SECONDS, TimeUnit.SECONDS);

    assertEquals(SessionState.FAILED, session.state());
    assertEquals(AnalysisErrorKind.CANCELLED, session.failure().kind());
    assertEquals(0, health.snapshot("on-device").sampleCount(), "cancelled calls are not health samples");
    assertEquals(1, metrics.count("analysis.session.failed.cancelled"));
  }

  @Test
  void photoPreemptsRunningFrame() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .thenRespond(Step.detects(Hit.of(DEBRIS, 0.5d)).after(10_000L))
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(20_000L, 20_000L, false), onDevice);

    Optional<AnalysisHandle> frame = orchestrator.submitFrame(image(), AnalysisContext.DEFAULT);
    assertTrue(frame.isPresent());
    assertEquals(SubmissionKind.FRAME, frame.get().kind());
    assertTrue(onDevice.awaitEntered(1, 2_000L));

    AnalysisHandle photo = orchestrator.submitPhotoAsync(image(), AnalysisContext.DEFAULT);

    AnalysisSession frameSession = frame.get().await(AWAIT_SECONDS, TimeUnit.SECONDS);
    AnalysisSession photoSession = photo.await(AWAIT_SECONDS, TimeUnit.SECONDS);
    assertEquals(AnalysisErrorKind.CANCELLED, frameSession.failure().kind());
    assertEquals(SessionState.COMPLETE, photoSession.state());
    assertEquals(HARD_HAT, photoSession.fusedHazards().get(0).type());
    assertEquals(1, metrics.count("analysis.session.preempted"));
  }

  @Test
  void framesAreThrottledButPhotosAreNot() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device");
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice);

    Optional<AnalysisHandle> first = orchestrator.submitFrame(image(), AnalysisContext.DEFAULT);
    Optional<AnalysisHandle> second = orchestrator.submitFrame(image(), AnalysisContext.DEFAULT);
    AnalysisSession photo = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertTrue(first.isPresent());
    assertTrue(second.isEmpty());
    assertEquals(SessionState.COMPLETE, photo.state());
    assertEquals(AnalysisThrottler.DEFAULT_MIN_INTERVAL_MILLIS, orchestrator.millisUntilNextFrame());
    first.get().await(AWAIT_SECONDS, TimeUnit.SECONDS);

    clock.advance(AnalysisThrottler.DEFAULT_MIN_INTERVAL_MILLIS);
    Optional<AnalysisHandle> third = orchestrator.submitFrame(image(), AnalysisContext.DEFAULT);
    assertTrue(third.isPresent());
    third.get().await(AWAIT_SECONDS, TimeUnit.SECONDS);
    assertEquals(1, metrics.count("analysis.throttle.dropped"));
    assertEquals(2, metrics.count("analysis.throttle.accepted"));
  }

  @Test
  void modelNotLoadedSchedulesReload() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.fails(BackendFailureKind.MODEL_NOT_LOADED));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(SessionState.COMPLETE, session.state());
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(AWAIT_SECONDS);
    while (metrics.count("analysis.backend.on-device.reload.success") == 0 && System.nanoTime() < deadline) {
      Thread.sleep(10L);
    }
    assertEquals(1, onDevice.reloads());
    assertEquals(1, metrics.count("analysis.backend.on-device.reload.success"));
    assertEquals(0, detector.reloads());
  }

  @Test
  void deprioritizedBackendMovesToEndOfChain() throws Exception {
    health = new BackendHealthRegistry(new HealthSettings(20, 0.5d, 1, 60_000L), clock);
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .thenRespond(Step.fails(BackendFailureKind.ENGINE_ERROR))
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    FakeBackend detector = FakeBackend.detector("detector").respondWith(Step.detects(Hit.of(SAFETY_VEST, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    AnalysisSession second = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(List.of("detector"), second.backendChain());
    assertEquals(1, onDevice.calls());

    clock.advance(60_001L);
    AnalysisSession third = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    assertEquals(List.of("on-device"), third.contributingBackends());
  }

  @Test
  void batchRespectsLocalSlotAndRemoteCap() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(100L));
    orchestrator = build(() -> ConnectionQuality.GOOD,
        new OrchestratorSettings(2_000L, 5_000L, 0.5d, 2, false, 5), remote);

    List<AnalysisImage> photos = Collections.nCopies(6, image());
    List<AnalysisSession> sessions = orchestrator.analyzeBatch(photos, AnalysisContext.DEFAULT);

    assertEquals(6, sessions.size());
    sessions.forEach(session -> assertEquals(SessionState.COMPLETE, session.state()));
    assertTrue(remote.maxConcurrentCalls() <= 2, "remote cap exceeded: " + remote.maxConcurrentCalls());
  }

  @Test
  void localBackendNeverRunsConcurrently() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)).after(50L));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(5_000L, 5_000L, false), onDevice);

    List<AnalysisSession> sessions =
        orchestrator.analyzeBatch(Collections.nCopies(4, image()), AnalysisContext.DEFAULT, 4);

    assertEquals(4, sessions.size());
    assertEquals(1, onDevice.maxConcurrentCalls());
    assertFalse(orchestrator.localSlot().isHeld());
  }

  @Test
  void stuckLocalEngineDoesNotBlockLaterSessions() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .thenRespond(Step.detects(Hit.of(DEBRIS, 0.5d)).after(1_500L).ignoringInterrupts())
        .respondWith(Step.detects(Hit.of(DEBRIS, 0.5d)));
    FakeBackend remote = FakeBackend.remote("remote-vision").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = build(() -> ConnectionQuality.GOOD, settings(200L, 5_000L, false), onDevice, remote);

    AnalysisSession first = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    long startNanos = System.nanoTime();
    AnalysisSession second = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    long secondMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

    assertEquals(List.of("remote-vision"), first.contributingBackends());
    assertEquals(SessionState.COMPLETE, second.state());
    assertEquals(List.of("remote-vision"), second.contributingBackends());
    assertTrue(secondMillis < 1_000L, "second session waited " + secondMillis + " ms for the busy engine");
    assertEquals(1, onDevice.calls(), "the waiting call never reaches the engine");
    assertEquals(2, metrics.count("analysis.backend.on-device.failure.timeout"));
  }

  @Test
  void resubmittedPhotoIsServedFromCache() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = buildCached(new CacheSettings(8, 60_000L), remote);

    AnalysisSession first = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    AnalysisSession second = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

    assertEquals(1, remote.calls());
    assertEquals(SessionState.COMPLETE, second.state());
    assertFalse(first.correlationId().equals(second.correlationId()));
    assertEquals(first.fusedHazards(), second.fusedHazards());
    assertEquals(first.autoSelectTags(), second.autoSelectTags());
    assertEquals(List.of("remote-vision"), second.contributingBackends());
    assertTrue(second.backendChain().isEmpty(), "no backend is called for a cached result");
    assertEquals(List.of(SessionState.IDLE, SessionState.SELECTING_BACKENDS, SessionState.ANALYZING,
        SessionState.FUSING, SessionState.RECOMMENDING, SessionState.COMPLETE), second.stateHistory());
    assertEquals(1, metrics.count("analysis.cache.hit"));
    assertEquals(1, metrics.count("analysis.cache.miss"));
  }

  @Test
  void cacheKeyIncludesWorkTypeAndExpires() throws Exception {
    FakeBackend remote = FakeBackend.remote("remote-vision").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = buildCached(new CacheSettings(8, 60_000L), remote);
    AnalysisContext roofing = new AnalysisContext("roofing", false, Map.of());

    orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    orchestrator.submitPhoto(image(), roofing);
    assertEquals(2, remote.calls());

    clock.advance(60_000L);
    orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    assertEquals(3, remote.calls());
    assertEquals(0, metrics.count("analysis.cache.hit"));
  }

  @Test
  void failedSessionsAndFramesAreNotCached() throws Exception {
    FakeBackend onDevice = FakeBackend.onDevice("on-device")
        .thenRespond(Step.fails(BackendFailureKind.ENGINE_ERROR))
        .respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    orchestrator = buildCached(new CacheSettings(8, 60_000L), onDevice);

    AnalysisSession failed = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    assertEquals(SessionState.FAILED, failed.state());
    assertEquals(0, orchestrator.resultCache().size());

    Optional<AnalysisHandle> frame = orchestrator.submitFrame(image(), AnalysisContext.DEFAULT);
    assertEquals(SessionState.COMPLETE, frame.orElseThrow().await(AWAIT_SECONDS, TimeUnit.SECONDS).state());
    assertEquals(0, orchestrator.resultCache().size());

    AnalysisSession retried = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    assertEquals(SessionState.COMPLETE, retried.state());
    assertEquals(3, onDevice.calls());
    assertEquals(1, orchestrator.resultCache().size());
    assertEquals(0, metrics.count("analysis.cache.hit"));
  }

  @Test
  void persistedHealthIsSeededAndSavedOnClose() throws Exception {
    InMemoryHealthStore memory = new InMemoryHealthStore(
        List.of(new PersistedHealth("detector", 0.25d, 1_600_000_000_000L)));
    store = memory;
    FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
    FakeBackend detector = FakeBackend.detector("detector");
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice, detector);

    HealthReport before = orchestrator.performHealthCheck();
    HealthReport.BackendStatus detectorStatus = before.backends().stream()
        .filter(status -> status.backendId().equals("detector")).findFirst().orElseThrow();
    assertEquals(0.25d, detectorStatus.successRate(), 1e-9);
    assertTrue(before.anyUsable());

    orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);
    orchestrator.close();

    List<PersistedHealth> saved = memory.saved();
    assertEquals(2, saved.size());
    assertEquals("detector", saved.get(0).backendId());
    assertEquals("on-device", saved.get(1).backendId());
    assertEquals(1d, saved.get(1).rollingSuccessRate(), 1e-9);
  }

  @Test
  void closedOrchestratorRejectsSubmissions() {
    orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(),
        FakeBackend.onDevice("on-device"));
    orchestrator.close();

    assertThrows(IllegalStateException.class,
        () -> orchestrator.submitPhotoAsync(image(), AnalysisContext.DEFAULT));
  }

  @Test
  void duplicateBackendIdsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> build(() -> ConnectionQuality.GOOD,
        OrchestratorSettings.defaults(), FakeBackend.onDevice("dup"), FakeBackend.detector("dup")));
  }

  @Test
  void sessionLogsCarryCorrelationId() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(SmartAnalysisOrchestrator.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>() {
      @Override
      protected void append(ILoggingEvent event) {
        event.prepareForDeferredProcessing();
        super.append(event);
      }
    };
    appender.start();
    logger.addAppender(appender);
    try {
      FakeBackend onDevice = FakeBackend.onDevice("on-device").respondWith(Step.detects(Hit.of(HARD_HAT, 0.9d)));
      orchestrator = build(() -> ConnectionQuality.GOOD, OrchestratorSettings.defaults(), onDevice);

      AnalysisSession session = orchestrator.submitPhoto(image(), AnalysisContext.DEFAULT);

      List<ILoggingEvent> events;
      synchronized (appender) {
        events = new ArrayList<>(appender.list);
      }
      ILoggingEvent completed = events.stream()
          .filter(event -> event.getFormattedMessage().startsWith("Session complete"))
          .findFirst()
          .orElseThrow();
      assertEquals(session.correlationId(),
          completed.getMDCPropertyMap().get(SmartAnalysisOrchestrator.MDC_SESSION));
    } finally {
      logger.detachAppender(appender);
    }
  }

  private SmartAnalysisOrchestrator build(
      ConnectivityMonitor connectivity, OrchestratorSettings settings, FakeBackend... backends) {
    return new SmartAnalysisOrchestrator(
        List.of(backends),
        connectivity,
        new AnalysisThrottler(AnalysisThrottler.DEFAULT_MIN_INTERVAL_MILLIS, clock, metrics),
        new ResultFusionEngine(FusionSettings.defaults(), AnalysisFixtures.taxonomy(), metrics),
        new TagRecommendationEngine(AnalysisFixtures.taxonomy(), RecommendationSettings.defaults(), metrics),
        health,
        store,
        settings,
        metrics,
        clock);
  }

  private SmartAnalysisOrchestrator buildCached(CacheSettings cacheSettings, FakeBackend... backends) {
    return new SmartAnalysisOrchestrator(
        List.of(backends),
        () -> ConnectionQuality.GOOD,
        new AnalysisThrottler(AnalysisThrottler.DEFAULT_MIN_INTERVAL_MILLIS, clock, metrics),
        new ResultFusionEngine(FusionSettings.defaults(), AnalysisFixtures.taxonomy(), metrics),
        new TagRecommendationEngine(AnalysisFixtures.taxonomy(), RecommendationSettings.defaults(), metrics),
        health,
        store,
        OrchestratorSettings.defaults(),
        metrics,
        clock,
        new AnalysisResultCache(cacheSettings, clock));
  }

  private static OrchestratorSettings settings(long localMillis, long remoteMillis, boolean hybrid) {
    return new OrchestratorSettings(localMillis, remoteMillis, 0.5d, 3, hybrid, 3);
  }

  private static final class InMemoryHealthStore implements BackendHealthStore {
    private final List<PersistedHealth> initial;
    private volatile List<PersistedHealth> saved = List.of();

    private InMemoryHealthStore(List<PersistedHealth> initial) {
      this.initial = List.copyOf(initial);
    }

    @Override
    public List<PersistedHealth> load() {
      return initial;
    }

    @Override
    public void save(List<PersistedHealth> records) {
      saved = List.copyOf(records);
    }

    List<PersistedHealth> saved() {
      return saved;
    }
  }
}
