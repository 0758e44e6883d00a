package ca.siteguard.application.analysis;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.domain.backend.BackendFailure;
import ca.siteguard.domain.backend.BackendFailureKind;
import ca.siteguard.domain.backend.BackendOutcome;
import ca.siteguard.domain.backend.BackendTier;
import ca.siteguard.domain.backend.CostClass;
import ca.siteguard.domain.hazard.BoundingRegion;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardDetection;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted backend. Each call takes the next queued {@link Step}, or the default step once the queue is empty.
 */
final class FakeBackend implements AnalyzerBackend {
  private final String id;
  private final BackendTier tier;
  private final Set<HazardCategory> capabilities;
  private final ConcurrentLinkedDeque<Step> script = new ConcurrentLinkedDeque<>();
  private final Semaphore entered = new Semaphore(0);
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger reloads = new AtomicInteger();
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger maxActive = new AtomicInteger();
  private volatile Step fallback = Step.detects();
  private volatile boolean available = true;

  private FakeBackend(String id, BackendTier tier, Set<HazardCategory> capabilities) {
    this.id = id;
    this.tier = tier;
    this.capabilities = Set.copyOf(capabilities);
  }

  static FakeBackend onDevice(String id) {
    return new FakeBackend(id, BackendTier.ON_DEVICE_MULTIMODAL, EnumSet.allOf(HazardCategory.class));
  }

  static FakeBackend remote(String id) {
    return new FakeBackend(id, BackendTier.REMOTE_VISION, EnumSet.allOf(HazardCategory.class));
  }

  static FakeBackend detector(String id) {
    return new FakeBackend(id, BackendTier.LOCAL_DETECTOR,
        EnumSet.of(HazardCategory.PPE, HazardCategory.FALL_PROTECTION, HazardCategory.EQUIPMENT));
  }

  FakeBackend respondWith(Step step) {
    this.fallback = step;
    return this;
  }

  FakeBackend thenRespond(Step step) {
    script.addLast(step);
    return this;
  }

  FakeBackend unavailable() {
    this.available = false;
    return this;
  }

  int calls() {
    return calls.get();
  }

  int reloads() {
    return reloads.get();
  }

  int maxConcurrentCalls() {
    return maxActive.get();
  }

  boolean awaitEntered(int count, long timeoutMillis) throws InterruptedException {
    return entered.tryAcquire(count, timeoutMillis, TimeUnit.MILLISECONDS);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public BackendTier tier() {
    return tier;
  }

  @Override
  public CostClass costClass() {
    return tier.local() ? CostClass.LOCAL_COMPUTE : CostClass.REMOTE_METERED;
  }

  @Override
  public Set<HazardCategory> capabilities() {
    return capabilities;
  }

  @Override
  public boolean available() {
    return available;
  }

  @Override
  public boolean reloadModel() {
    reloads.incrementAndGet();
    return true;
  }

  @Override
  public BackendOutcome analyze(AnalysisImage image, AnalysisContext context) {
    calls.incrementAndGet();
    int now = active.incrementAndGet();
    maxActive.accumulateAndGet(now, Math::max);
    entered.release();
    Step step = script.pollFirst();
    if (step == null) {
      step = fallback;
    }
    try {
      if (step.ignoresInterrupts()) {
        sleepThroughInterrupts(step.delayMillis());
      } else if (step.delayMillis() > 0L) {
        Thread.sleep(step.delayMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return BackendOutcome.failure(id, tier, BackendFailure.of(BackendFailureKind.CANCELLED, "interrupted"), 0L);
    } finally {
      active.decrementAndGet();
    }
    if (step.thrown() != null) {
      throw step.thrown();
    }
    if (step.failure() != null) {
      return BackendOutcome.failure(id, tier, BackendFailure.of(step.failure(), "scripted"), step.delayMillis());
    }
    List<HazardDetection> detections = new ArrayList<>(step.hits().size());
    for (Hit hit : step.hits()) {
      detections.add(AnalysisFixtures.detection(id, hit.type(), hit.confidence(), hit.region()));
    }
    return BackendOutcome.success(id, tier, detections, step.delayMillis());
  }

  private static void sleepThroughInterrupts(long millis) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    boolean interrupted = false;
    long remaining;
    while ((remaining = deadline - System.nanoTime()) > 0L) {
      try {
        TimeUnit.NANOSECONDS.sleep(remaining);
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Detection template; the backend id is filled in when the step runs. */
  record Hit(HazardType type, double confidence, BoundingRegion region) {
    static Hit of(HazardType type, double confidence) {
      return new Hit(type, confidence, BoundingRegion.FULL_FRAME);
    }
  }

  /** One scripted response. */
  record Step(
      long delayMillis, List<Hit> hits, BackendFailureKind failure, RuntimeException thrown,
      boolean ignoresInterrupts) {
    static Step detects(Hit... hits) {
      return new Step(0L, List.of(hits), null, null, false);
    }

    static Step fails(BackendFailureKind kind) {
      return new Step(0L, List.of(), kind, null, false);
    }

    static Step throwing(RuntimeException ex) {
      return new Step(0L, List.of(), null, ex, false);
    }

    Step after(long millis) {
      return new Step(millis, hits, failure, thrown, ignoresInterrupts);
    }

    /** Keeps running through cancellation, like an engine stuck in native code. */
    Step ignoringInterrupts() {
      return new Step(delayMillis, hits, failure, thrown, true);
    }
  }
}
