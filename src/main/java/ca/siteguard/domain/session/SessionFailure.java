package ca.siteguard.domain.session;

import java.util.Objects;

/**
 * Caller-visible reason a session ended {@link SessionState#FAILED}.
 *
 * @param kind error kind; always a surfaced kind
 * @param userMessage text suitable for showing to the inspector
 * @param detail diagnostic detail for logs and support
 * @since SiteGuard 0.1
 */
public record SessionFailure(AnalysisErrorKind kind, String userMessage, String detail) {
  static final String RETAKE_MESSAGE = "Could not analyze this image. Please retake the photo.";
  static final String MANUAL_TAGGING_MESSAGE =
      "Analysis is temporarily unavailable. Please tag this photo manually.";
  static final String CANCELLED_MESSAGE = "Analysis was cancelled.";

  public SessionFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(userMessage, "userMessage");
    detail = detail == null ? "" : detail;
    if (!kind.surfaced()) {
      throw new IllegalArgumentException(kind + " is not a session failure kind");
    }
  }

  /**
   * Failure for an image no backend can analyze; the user should retake it.
   *
   * @param detail diagnostic detail
   * @return failure
   */
  public static SessionFailure malformedInput(String detail) {
    return new SessionFailure(AnalysisErrorKind.MALFORMED_INPUT, RETAKE_MESSAGE, detail);
  }

  /**
   * Failure when every backend was unavailable or failed; the user should tag manually.
   *
   * @param detail diagnostic detail
   * @return failure
   */
  public static SessionFailure noBackendAvailable(String detail) {
    return new SessionFailure(AnalysisErrorKind.NO_BACKEND_AVAILABLE, MANUAL_TAGGING_MESSAGE, detail);
  }

  public static SessionFailure cancelled(String detail) {
    return new SessionFailure(AnalysisErrorKind.CANCELLED, CANCELLED_MESSAGE, detail);
  }
}
