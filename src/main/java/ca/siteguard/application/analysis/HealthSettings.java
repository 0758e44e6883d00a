package ca.siteguard.application.analysis;

import ca.siteguard.validation.Numbers;

/**
 * Tunables for {@link BackendHealthRegistry}.
 *
 * @param windowSize number of most recent calls kept per backend
 * @param minSuccessRate success rate below which a backend is deprioritized
 * @param minimumSamples calls required in the window before the rate is trusted
 * @param deprioritizeMillis how long a deprioritized backend stays at the end of the chain
 * @since SiteGuard 0.1
 */
public record HealthSettings(int windowSize, double minSuccessRate, int minimumSamples, long deprioritizeMillis) {
  public static final int DEFAULT_WINDOW_SIZE = 20;
  public static final double DEFAULT_MIN_SUCCESS_RATE = 0.5d;
  public static final int DEFAULT_MINIMUM_SAMPLES = 3;
  public static final long DEFAULT_DEPRIORITIZE_MILLIS = 5L * 60L * 1000L;

  public HealthSettings {
    Numbers.requireRange("health.windowSize", windowSize, 1, 10_000);
    Numbers.requireUnitInterval("health.minSuccessRate", minSuccessRate);
    Numbers.requireRange("health.minimumSamples", minimumSamples, 1, windowSize);
    Numbers.requireRange("health.deprioritizeMillis", deprioritizeMillis, 0L, Long.MAX_VALUE / 2);
  }

  public static HealthSettings defaults() {
    return new HealthSettings(
        DEFAULT_WINDOW_SIZE, DEFAULT_MIN_SUCCESS_RATE, DEFAULT_MINIMUM_SAMPLES, DEFAULT_DEPRIORITIZE_MILLIS);
  }
}
