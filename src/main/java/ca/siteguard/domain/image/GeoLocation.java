package ca.siteguard.domain.image;

import ca.siteguard.validation.Numbers;

/**
 * WGS84 position where an image was captured.
 *
 * @param latitude degrees in {@code [-90, 90]}
 * @param longitude degrees in {@code [-180, 180]}
 * @param accuracyMeters horizontal accuracy radius; {@code 0} when unknown
 * @since SiteGuard 0.1
 */
public record GeoLocation(double latitude, double longitude, double accuracyMeters) {
  public GeoLocation {
    Numbers.requireRange("latitude", latitude, -90d, 90d);
    Numbers.requireRange("longitude", longitude, -180d, 180d);
    Numbers.requireRange("accuracyMeters", accuracyMeters, 0d, Double.MAX_VALUE);
  }
}
