package ca.siteguard.domain.image;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Capture-time facts supplied by the camera subsystem.
 *
 * @param capturedAt instant the image was taken
 * @param location capture position, or {@code null} when location was unavailable
 * @since SiteGuard 0.1
 */
public record CaptureMetadata(Instant capturedAt, GeoLocation location) {
  public CaptureMetadata {
    Objects.requireNonNull(capturedAt, "capturedAt");
  }

  /**
   * Creates metadata without a location.
   *
   * @param capturedAt capture instant
   * @return metadata with no location
   */
  public static CaptureMetadata at(Instant capturedAt) {
    return new CaptureMetadata(capturedAt, null);
  }

  public Optional<GeoLocation> locationIfKnown() {
    return Optional.ofNullable(location);
  }
}
