package ca.siteguard.application.analysis;

import ca.siteguard.application.port.AnalyzerBackend;
import ca.siteguard.application.port.ConnectionQuality;
import ca.siteguard.domain.backend.BackendTier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the ordered backend chain for a session.
 *
 * <p>Order: available on-device multimodal backends, then available remote backends when connected, then
 * available lightweight detectors. Within a tier, registration order is kept. Deprioritized backends are
 * moved to the end of the chain, keeping their relative order.</p>
 *
 * @since SiteGuard 0.1
 */
final class BackendSelector {
  private static final BackendTier[] PREFERENCE = {
      BackendTier.ON_DEVICE_MULTIMODAL, BackendTier.REMOTE_VISION, BackendTier.LOCAL_DETECTOR
  };

  private final List<AnalyzerBackend> backends;
  private final BackendHealthRegistry health;

  BackendSelector(List<AnalyzerBackend> backends, BackendHealthRegistry health) {
    this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
    this.health = Objects.requireNonNull(health, "health");
  }

  /**
   * Selects the chain for the current connectivity.
   *
   * @param quality connectivity at session start
   * @return ordered chain; empty when nothing can run
   */
  List<AnalyzerBackend> select(ConnectionQuality quality) {
    List<AnalyzerBackend> preferred = new ArrayList<>();
    List<AnalyzerBackend> demoted = new ArrayList<>();
    for (BackendTier tier : PREFERENCE) {
      if (!tier.local() && !quality.connected()) {
        continue;
      }
      for (AnalyzerBackend backend : backends) {
        if (backend.tier() != tier || !backend.available()) {
          continue;
        }
        if (health.isDeprioritized(backend.id())) {
          demoted.add(backend);
        } else {
          preferred.add(backend);
        }
      }
    }
    preferred.addAll(demoted);
    return preferred;
  }

  List<AnalyzerBackend> backends() {
    return backends;
  }
}
