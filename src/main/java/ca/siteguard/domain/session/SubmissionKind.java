package ca.siteguard.domain.session;

/**
 * How an image entered the pipeline.
 *
 * @since SiteGuard 0.1
 */
public enum SubmissionKind {
  /** Single-shot capture; never throttled and takes priority on the local inference slot. */
  PHOTO,
  /** Live-stream frame; throttled and preemptible by photos. */
  FRAME
}
