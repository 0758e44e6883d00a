package ca.siteguard.application.port;

import java.util.Objects;

/**
 * Checked exception raised by {@link InferenceEngine} implementations.
 *
 * @since SiteGuard 0.1
 */
public class InferenceException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why inference could not produce a result. */
  public enum Reason {
    /** Model weights are not in memory. */
    MODEL_NOT_LOADED,
    /** Input could not be decoded or has unsupported dimensions. */
    INVALID_INPUT,
    /** Any other runtime failure inside the engine. */
    RUNTIME
  }

  private final Reason reason;

  public InferenceException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public InferenceException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}
