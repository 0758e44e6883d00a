package ca.siteguard.application.analysis;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.PersistedHealth;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-wide rolling reliability state for every analysis backend.
 * <p><strong>Why:</strong> A backend that keeps failing should stop costing sessions a timeout; it is moved to the
 * end of the selection chain for a cooldown period instead of being removed.</p>
 * <p><strong>Role:</strong> The only mutable state shared across sessions; owned by the orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Each update replaces an immutable {@link BackendHealth} snapshot inside
 * {@link ConcurrentHashMap#compute}, so concurrent hybrid or batch sessions cannot lose samples.</p>
 * <p><strong>Observability:</strong> Logs at WARN when a backend becomes deprioritized.</p>
 *
 * @since SiteGuard 0.1
 */
public final class BackendHealthRegistry {
  private static final Logger log = LoggerFactory.getLogger(BackendHealthRegistry.class);

  private final ConcurrentHashMap<String, BackendHealth> health = new ConcurrentHashMap<>();
  private final HealthSettings settings;
  private final ClockPort clock;

  public BackendHealthRegistry(HealthSettings settings, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records a completed backend call. Cancelled calls are ignored.
   *
   * @param outcome outcome of the call
   * @return updated snapshot, or the unchanged snapshot when the outcome was a cancellation
   */
  public BackendHealth record(BackendOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    BackendFailureKind kind = outcome.failureKind();
    if (kind == BackendFailureKind.CANCELLED) {
      return snapshot(outcome.backendId());
    }
    BackendHealth.CallSample sample =
        new BackendHealth.CallSample(outcome.isSuccess(), outcome.latencyMillis(), kind);
    long now = clock.nowMillis();
    long[] previousDeadline = new long[1];
    BackendHealth updated = health.compute(outcome.backendId(), (id, current) -> {
      BackendHealth base = current == null ? BackendHealth.empty(id) : current;
      previousDeadline[0] = base.deprioritizedUntilMillis();
      return base.record(sample, settings, now);
    });
    if (updated.isDeprioritized(now) && previousDeadline[0] <= now) {
      log.warn("Backend {} deprioritized until {} (successRate={}, samples={}, lastFailure={})",
          outcome.backendId(), updated.deprioritizedUntilMillis(),
          String.format("%.2f", updated.successRate()), updated.sampleCount(), kind);
    }
    return updated;
  }

  /**
   * Returns the current snapshot for a backend.
   *
   * @param backendId backend id
   * @return snapshot; empty when the backend has no history
   */
  public BackendHealth snapshot(String backendId) {
    return health.getOrDefault(backendId, BackendHealth.empty(backendId));
  }

  /**
   * Returns all snapshots keyed by backend id, sorted by id.
   *
   * @return immutable copy
   */
  public Map<String, BackendHealth> snapshots() {
    return Map.copyOf(new TreeMap<>(health));
  }

  public boolean isDeprioritized(String backendId) {
    return snapshot(backendId).isDeprioritized(clock.nowMillis());
  }

  /**
   * Seeds baselines from persisted records. Existing in-memory history wins over persisted data.
   *
   * @param records persisted records
   */
  public void seed(Collection<PersistedHealth> records) {
    for (PersistedHealth record : records) {
      health.compute(record.backendId(), (id, current) -> {
        if (current != null && current.sampleCount() > 0) {
          return current;
        }
        return new BackendHealth(id, List.of(), record.rollingSuccessRate(), record.lastFailureAtMillis(), 0L);
      });
    }
  }

  /**
   * Converts the current state into persistable records, sorted by backend id.
   *
   * @return records
   */
  public List<PersistedHealth> toPersisted() {
    List<PersistedHealth> records = new ArrayList<>();
    for (BackendHealth snapshot : new TreeMap<>(health).values()) {
      records.add(new PersistedHealth(
          snapshot.backendId(), snapshot.successRate(), snapshot.lastFailureAtMillis()));
    }
    return records;
  }

  /** Clears all state; used between tests and after configuration reloads. */
  public void reset() {
    health.clear();
  }

  public HealthSettings settings() {
    return settings;
  }
}
