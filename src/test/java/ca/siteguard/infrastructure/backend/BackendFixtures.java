package ca.siteguard.infrastructure.backend;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.application.port.InferenceEngine;
import ca.siteguard.application.port.InferenceException;
import ca.siteguard.application.port.MetricsPort;
import ca.siteguard.application.port.RawDetection;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.hazard.HazardType;
import ca.siteguard.domain.hazard.Severity;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.image.CaptureMetadata;
import ca.siteguard.domain.tag.ComplianceTag;
import ca.siteguard.domain.tag.HazardMapping;
import ca.siteguard.domain.tag.HazardTaxonomy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Taxonomy, images and test doubles shared by backend adapter tests. */
final class BackendFixtures {
  static final Instant CAPTURED_AT = Instant.parse("2024-05-01T14:30:00Z");
  static final ClockPort CLOCK = () -> 1_714_573_800_000L;
  static final HazardType HARD_HAT = HazardType.of("MISSING_HARD_HAT");
  static final HazardType EXPOSED_WIRING = HazardType.of("EXPOSED_WIRING");

  private BackendFixtures() {}

  static HazardTaxonomy taxonomy() {
    return new HazardTaxonomy(
        List.of(
            new ComplianceTag("ppe-hard-hat-required", "Hard hat required", HazardCategory.PPE,
                List.of("29 CFR 1926.100"), 10),
            new ComplianceTag("electrical-exposed-conductors", "Exposed conductors", HazardCategory.ELECTRICAL,
                List.of("29 CFR 1926.405"), 8)),
        List.of(
            new HazardMapping(HARD_HAT, Severity.HIGH, HazardCategory.PPE,
                List.of("ppe-hard-hat-required"), List.of("no_helmet")),
            new HazardMapping(EXPOSED_WIRING, Severity.CRITICAL, HazardCategory.ELECTRICAL,
                List.of("electrical-exposed-conductors"), List.of("live wire"))));
  }

  static AnalysisImage image() {
    return new AnalysisImage(new byte[] {10, 20, 30}, 200, 100, CaptureMetadata.at(CAPTURED_AT));
  }

  static AnalysisImage emptyImage() {
    return new AnalysisImage(new byte[0], 200, 100, CaptureMetadata.at(CAPTURED_AT));
  }

  /** Inference engine returning scripted results. */
  static final class ScriptedEngine implements InferenceEngine {
    private volatile boolean loaded;
    private volatile boolean loadSucceeds = true;
    private List<RawDetection> detections = List.of();
    private InferenceException failure;
    private RuntimeException unexpected;
    int loadCalls;

    ScriptedEngine(boolean loaded) {
      this.loaded = loaded;
    }

    ScriptedEngine returning(RawDetection... raw) {
      this.detections = List.of(raw);
      return this;
    }

    ScriptedEngine failingWith(InferenceException ex) {
      this.failure = ex;
      return this;
    }

    ScriptedEngine throwing(RuntimeException ex) {
      this.unexpected = ex;
      return this;
    }

    ScriptedEngine loadFails() {
      this.loadSucceeds = false;
      return this;
    }

    @Override
    public boolean isLoaded() {
      return loaded;
    }

    @Override
    public void load() throws InferenceException {
      loadCalls++;
      if (!loadSucceeds) {
        throw new InferenceException(InferenceException.Reason.MODEL_NOT_LOADED, "model file missing");
      }
      loaded = true;
    }

    @Override
    public List<RawDetection> infer(AnalysisImage image) throws InferenceException {
      if (unexpected != null) {
        throw unexpected;
      }
      if (failure != null) {
        throw failure;
      }
      return new ArrayList<>(detections);
    }
  }

  /** Captures counters for assertions. */
  static final class RecordingMetricsPort implements MetricsPort {
    private final Map<String, Integer> counters = new HashMap<>();

    @Override
    public synchronized void increment(String key) {
      counters.merge(key, 1, Integer::sum);
    }

    @Override
    public void observe(String key, long value) {}

    synchronized int count(String key) {
      return counters.getOrDefault(key, 0);
    }
  }
}
