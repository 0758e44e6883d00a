package ca.siteguard.application.analysis;

import static ca.siteguard.application.analysis.AnalysisFixtures.CAPTURED_AT;
import static ca.siteguard.application.analysis.AnalysisFixtures.HARD_HAT;
import static ca.siteguard.application.analysis.AnalysisFixtures.image;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.siteguard.domain.hazard.HazardCategory;
import ca.siteguard.domain.image.AnalysisContext;
import ca.siteguard.domain.image.AnalysisImage;
import ca.siteguard.domain.image.CaptureMetadata;
import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.session.SessionFailure;
import ca.siteguard.domain.session.SessionState;
import ca.siteguard.domain.session.SubmissionKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AnalysisResultCacheTest {
  private final ManualClock clock = new ManualClock(1_700_000_000_000L);
  private final AnalysisResultCache cache = new AnalysisResultCache(new CacheSettings(2, 1_000L), clock);

  @Test
  void keyDependsOnContentWorkTypeAndRecall() {
    AnalysisResultCache.Key base = AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT);

    assertEquals(base, AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT));
    assertEquals(64, base.contentHash().length());
    assertNotEquals(base, AnalysisResultCache.keyFor(otherImage(), AnalysisContext.DEFAULT));
    assertNotEquals(base,
        AnalysisResultCache.keyFor(image(), new AnalysisContext("roofing", false, Map.of())));
    assertNotEquals(base, AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT.withRecallPriority()));
  }

  @Test
  void storedCompleteSessionIsReturnedUntilExpiry() {
    AnalysisResultCache.Key key = AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT);
    assertTrue(cache.lookup(key).isEmpty());

    assertTrue(cache.store(key, completed()));
    AnalysisResultCache.CachedAnalysis cached = cache.lookup(key).orElseThrow();
    assertEquals(HARD_HAT, cached.fusedHazards().get(0).type());
    assertEquals(List.of("on-device"), cached.contributingBackends());
    assertEquals(Set.of(HazardCategory.PPE), cached.coveredCategories());

    clock.advance(999L);
    assertTrue(cache.lookup(key).isPresent());
    clock.advance(1L);
    assertTrue(cache.lookup(key).isEmpty());
    assertEquals(0, cache.size());
  }

  @Test
  void failedSessionsAreRejected() {
    AnalysisResultCache.Key key = AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT);

    assertFalse(cache.store(key, failed()));
    assertTrue(cache.lookup(key).isEmpty());
  }

  @Test
  void leastRecentlyUsedEntryIsEvicted() {
    AnalysisResultCache.Key first = AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT);
    AnalysisResultCache.Key second = AnalysisResultCache.keyFor(otherImage(), AnalysisContext.DEFAULT);
    AnalysisResultCache.Key third =
        AnalysisResultCache.keyFor(image(), new AnalysisContext("excavation", false, Map.of()));

    cache.store(first, completed());
    cache.store(second, completed());
    cache.lookup(first);
    cache.store(third, completed());

    assertEquals(2, cache.size());
    assertTrue(cache.lookup(first).isPresent());
    assertTrue(cache.lookup(second).isEmpty());
    assertTrue(cache.lookup(third).isPresent());
  }

  @Test
  void disabledCacheStoresNothing() {
    AnalysisResultCache disabled = AnalysisResultCache.disabled();
    AnalysisResultCache.Key key = AnalysisResultCache.keyFor(image(), AnalysisContext.DEFAULT);

    assertFalse(disabled.enabled());
    assertFalse(disabled.store(key, completed()));
    assertEquals(0, disabled.size());
  }

  private static AnalysisImage otherImage() {
    return new AnalysisImage(new byte[] {9, 8, 7, 6}, 640, 480, CaptureMetadata.at(CAPTURED_AT));
  }

  private static AnalysisSession completed() {
    return new AnalysisSession(
        "photo-1",
        SubmissionKind.PHOTO,
        List.of(AnalysisFixtures.fused(HARD_HAT, 0.9d)),
        List.of(),
        Set.of(),
        false,
        List.of("on-device"),
        List.of("on-device"),
        EnumSet.of(HazardCategory.PPE),
        CAPTURED_AT,
        120L,
        List.of(SessionState.IDLE, SessionState.SELECTING_BACKENDS, SessionState.ANALYZING,
            SessionState.FUSING, SessionState.RECOMMENDING, SessionState.COMPLETE),
        null);
  }

  private static AnalysisSession failed() {
    return new AnalysisSession(
        "photo-2",
        SubmissionKind.PHOTO,
        List.of(),
        List.of(),
        Set.of(),
        false,
        List.of("on-device"),
        List.of(),
        Set.of(),
        CAPTURED_AT,
        40L,
        List.of(SessionState.IDLE, SessionState.SELECTING_BACKENDS, SessionState.ANALYZING, SessionState.FAILED),
        SessionFailure.noBackendAvailable("on-device: ENGINE_ERROR"));
  }
}
