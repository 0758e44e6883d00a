package ca.siteguard.application.analysis;

import ca.siteguard.application.port.ClockPort;
import ca.siteguard.domain.hazard.FusedHazard;
import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.session.AnalysisSession;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Bounded, expiring cache of completed photo analyses.
 * <p><strong>Why:</strong> Re-submitting the same photo for the same work type must not cost another metered
 * remote call.</p>
 * <p><strong>Policy:</strong> Keys are the SHA-256 of the image bytes plus work type and recall priority. Entries
 * are evicted least-recently-used once {@link CacheSettings#maxEntries()} is exceeded and expire
 * {@link CacheSettings#ttlMillis()} after they were stored. Only COMPLETE sessions are accepted.</p>
 * <p><strong>Thread-safety:</strong> All access is synchronized on the cache.</p>
 *
 * @since SiteGuard 0.1
 */
public final class AnalysisResultCache {
  private final CacheSettings settings;
  private final ClockPort clock;
  private final LinkedHashMap<Key, Entry> entries;

  public AnalysisResultCache(CacheSettings settings, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    int maxEntries = settings.maxEntries();
    this.entries = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<Key, Entry> eldest) {
        return size() > maxEntries;
      }
    };
  }

  /**
   * Returns a cache that never stores anything.
   *
   * @return disabled cache
   */
  public static AnalysisResultCache disabled() {
    return new AnalysisResultCache(CacheSettings.DISABLED, ClockPort.SYSTEM);
  }

  public boolean enabled() {
    return settings.enabled();
  }

  /**
   * Builds the lookup key for an image and its request hints.
   *
   * @param image analyzed image
   * @param context request hints
   * @return content-addressed key
   */
  public static Key keyFor(AnalysisImage image, AnalysisContext context) {
    Objects.requireNonNull(image, "image");
    Objects.requireNonNull(context, "context");
    return new Key(sha256(image.bytes()), context.workType(), context.recallPriority());
  }

  /**
   * Returns the unexpired result stored under {@code key}; expired entries are dropped.
   *
   * @param key lookup key
   * @return cached analysis, or empty on a miss
   */
  public synchronized Optional<CachedAnalysis> lookup(Key key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (clock.nowMillis() - entry.storedAtMillis() >= settings.ttlMillis()) {
      entries.remove(key);
      return Optional.empty();
    }
    return Optional.of(entry.analysis());
  }

  /**
   * Stores the outcome of a completed session. Failed sessions are ignored.
   *
   * @param key lookup key
   * @param session finalized session
   * @return {@code true} when the result was stored
   */
  public synchronized boolean store(Key key, AnalysisSession session) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(session, "session");
    if (!settings.enabled() || !session.isComplete()) {
      return false;
    }
    entries.put(key, new Entry(CachedAnalysis.of(session), clock.nowMillis()));
    return true;
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized void clear() {
    entries.clear();
  }

  private static String sha256(byte[] bytes) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  /** Content-addressed cache key. */
  public record Key(String contentHash, String workType, boolean recallPriority) {
    public Key {
      Objects.requireNonNull(contentHash, "contentHash");
      Objects.requireNonNull(workType, "workType");
    }
  }

  /**
   * Reusable part of a completed session.
   *
   * @param fusedHazards fused hazards, best first
   * @param recommendations tag recommendations
   * @param degradedCapability whether only lightweight detectors contributed
   * @param contributingBackends backends whose detections produced the result
   * @param coveredCategories categories those backends cover
   */
  public record CachedAnalysis(
      List<FusedHazard> fusedHazards,
      TagRecommendations recommendations,
      boolean degradedCapability,
      List<String> contributingBackends,
      Set<HazardCategory> coveredCategories) {
    public CachedAnalysis {
      fusedHazards = List.copyOf(fusedHazards);
      Objects.requireNonNull(recommendations, "recommendations");
      contributingBackends = List.copyOf(contributingBackends);
      coveredCategories = coveredCategories.isEmpty()
          ? Collections.unmodifiableSet(EnumSet.noneOf(HazardCategory.class))
          : Collections.unmodifiableSet(EnumSet.copyOf(coveredCategories));
    }

    static CachedAnalysis of(AnalysisSession session) {
      return new CachedAnalysis(
          session.fusedHazards(),
          new TagRecommendations(session.recommendations(), session.autoSelectTags()),
          session.degradedCapability(),
          session.contributingBackends(),
          session.coveredCategories());
    }
  }

  private record Entry(CachedAnalysis analysis, long storedAtMillis) {}
}
