package ca.siteguard.application.port;

import ca.siteguard.validation.Numbers;
import ca.siteguard.validation.Strings;

/**
 * Persisted reliability summary for one backend.
 *
 * @param backendId backend identifier
 * @param rollingSuccessRate success rate in {@code [0, 1]} at the time of saving
 * @param lastFailureAtMillis epoch millis of the last counted failure; {@code 0} when none
 * @since SiteGuard 0.1
 */
public record PersistedHealth(String backendId, double rollingSuccessRate, long lastFailureAtMillis) {
  public PersistedHealth {
    backendId = Strings.requireIdentifier("backendId", backendId);
    Numbers.requireUnitInterval("rollingSuccessRate", rollingSuccessRate);
    Numbers.requireRange("lastFailureAtMillis", lastFailureAtMillis, 0L, Long.MAX_VALUE);
  }
}
