package ca.siteguard.domain.backend;

import java.util.Objects;

/**
 * Classified failure of one backend call.
 *
 * @param kind failure kind driving retry and fallback
 * @param detail short diagnostic, safe to log (no credentials, bounded length)
 * @since SiteGuard 0.1
 */
public record BackendFailure(BackendFailureKind kind, String detail) {
  public BackendFailure {
    Objects.requireNonNull(kind, "kind");
    detail = detail == null ? "" : detail;
  }

  /**
   * Creates a failure of the given kind.
   *
   * @param kind failure kind
   * @param detail diagnostic text
   * @return failure value
   */
  public static BackendFailure of(BackendFailureKind kind, String detail) {
    return new BackendFailure(kind, detail);
  }
}
