package ca.siteguard.application.analysis;

import ca.siteguard.validation.Numbers;

/**
 * Tunables for {@link AnalysisResultCache}.
 *
 * @param maxEntries completed photo results kept; {@code 0} disables caching
 * @param ttlMillis how long a cached result may be served after it was stored
 * @since SiteGuard 0.1
 */
public record CacheSettings(int maxEntries, long ttlMillis) {
  public static final int DEFAULT_MAX_ENTRIES = 64;
  public static final long DEFAULT_TTL_MILLIS = 10L * 60L * 1000L;

  /** Settings that never store a result. */
  public static final CacheSettings DISABLED = new CacheSettings(0, 1L);

  public CacheSettings {
    Numbers.requireRange("cache.maxEntries", maxEntries, 0, 100_000);
    Numbers.requireRange("cache.ttlMillis", ttlMillis, 1L, 7L * 24L * 60L * 60L * 1000L);
  }

  public static CacheSettings defaults() {
    return new CacheSettings(DEFAULT_MAX_ENTRIES, DEFAULT_TTL_MILLIS);
  }

  public boolean enabled() {
    return maxEntries > 0;
  }
}
