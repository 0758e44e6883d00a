package ca.siteguard.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.siteguard.application.port.PersistedHealth;
import ca.siteguard.domain.backend.BackendFailure;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BackendHealthRegistryTest {
  private static final String REMOTE = "remote-vision";

  private final ManualClock clock = new ManualClock(1_000_000L);
  private BackendHealthRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new BackendHealthRegistry(HealthSettings.defaults(), clock);
  }

  @Test
  void unknownBackendIsHealthy() {
    BackendHealth health = registry.snapshot(REMOTE);
    assertEquals(1d, health.successRate());
    assertEquals(0, health.sampleCount());
    assertFalse(registry.isDeprioritized(REMOTE));
  }

  @Test
  void successRateBelowHalfDeprioritizesForFiveMinutes() {
    registry.record(success(100L));
    registry.record(failure(BackendFailureKind.TIMEOUT));
    assertFalse(registry.isDeprioritized(REMOTE), "50% is not below the threshold");

    BackendHealth health = registry.record(failure(BackendFailureKind.ENGINE_ERROR));

    assertEquals(1d / 3d, health.successRate(), 1e-9);
    assertTrue(registry.isDeprioritized(REMOTE));
    assertEquals(clock.nowMillis() + HealthSettings.DEFAULT_DEPRIORITIZE_MILLIS, health.deprioritizedUntilMillis());
    clock.advance(HealthSettings.DEFAULT_DEPRIORITIZE_MILLIS - 1L);
    assertTrue(registry.isDeprioritized(REMOTE));
    clock.advance(1L);
    assertFalse(registry.isDeprioritized(REMOTE));
  }

  @Test
  void fewerThanMinimumSamplesNeverDeprioritize() {
    registry.record(failure(BackendFailureKind.TIMEOUT));
    registry.record(failure(BackendFailureKind.TIMEOUT));
    assertFalse(registry.isDeprioritized(REMOTE));
    assertEquals(0d, registry.snapshot(REMOTE).successRate());
  }

  @Test
  void rateLimitingDeprioritizesImmediately() {
    registry.record(failure(BackendFailureKind.REMOTE_RATE_LIMITED));
    assertTrue(registry.isDeprioritized(REMOTE));
  }

  @Test
  void windowKeepsOnlyTheLatestTwentyCalls() {
    for (int i = 0; i < 20; i++) {
      registry.record(failure(BackendFailureKind.TIMEOUT));
    }
    for (int i = 0; i < 20; i++) {
      registry.record(success(10L));
    }
    BackendHealth health = registry.snapshot(REMOTE);
    assertEquals(20, health.sampleCount());
    assertEquals(1d, health.successRate());
  }

  @Test
  void cancelledCallsAreNotSamples() {
    registry.record(BackendOutcome.failure(REMOTE, BackendTier.REMOTE_VISION,
        BackendFailure.of(BackendFailureKind.CANCELLED, "caller"), 5L));
    assertEquals(0, registry.snapshot(REMOTE).sampleCount());
  }

  @Test
  void tracksLatencyAndLastFailure() {
    registry.record(success(100L));
    registry.record(success(300L));
    clock.advance(50L);
    registry.record(failure(BackendFailureKind.TRANSIENT_NETWORK));

    BackendHealth health = registry.snapshot(REMOTE);
    assertEquals(140L, health.averageLatencyMillis());
    assertEquals(clock.nowMillis(), health.lastFailureAtMillis());
  }

  @Test
  void seededBaselineIsUsedUntilFirstSample() {
    registry.seed(List.of(new PersistedHealth(REMOTE, 0.3d, 42L)));
    assertEquals(0.3d, registry.snapshot(REMOTE).successRate(), 1e-9);
    assertEquals(42L, registry.snapshot(REMOTE).lastFailureAtMillis());

    registry.record(success(10L));
    assertEquals(1d, registry.snapshot(REMOTE).successRate());
  }

  @Test
  void persistedSnapshotsRoundTripThroughSeed() {
    registry.record(success(10L));
    registry.record(failure(BackendFailureKind.TIMEOUT));
    List<PersistedHealth> persisted = registry.toPersisted();

    BackendHealthRegistry restored = new BackendHealthRegistry(HealthSettings.defaults(), clock);
    restored.seed(persisted);

    assertEquals(0.5d, restored.snapshot(REMOTE).successRate(), 1e-9);
  }

  @Test
  void resetClearsState() {
    registry.record(failure(BackendFailureKind.REMOTE_RATE_LIMITED));
    registry.reset();
    assertFalse(registry.isDeprioritized(REMOTE));
    assertTrue(registry.snapshots().isEmpty());
  }

  private static BackendOutcome success(long latencyMillis) {
    return BackendOutcome.success(REMOTE, BackendTier.REMOTE_VISION, List.of(), latencyMillis);
  }

  private static BackendOutcome failure(BackendFailureKind kind) {
    return BackendOutcome.failure(REMOTE, BackendTier.REMOTE_VISION, BackendFailure.of(kind, "test"), 20L);
  }
}
