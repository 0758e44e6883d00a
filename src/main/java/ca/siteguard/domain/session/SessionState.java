package ca.siteguard.domain.session;

/**
 * <strong>What:</strong> Lifecycle states of an analysis session.
 * <p><strong>Why:</strong> Sessions move forward only; encoding the legal edges here keeps the orchestrator from
 * publishing half-built results.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since SiteGuard 0.1
 */
public enum SessionState {
  IDLE,
  SELECTING_BACKENDS,
  ANALYZING,
  FUSING,
  RECOMMENDING,
  COMPLETE,
  FAILED;

  /**
   * Indicates whether the state ends the session.
   *
   * @return {@code true} for {@link #COMPLETE} and {@link #FAILED}
   */
  public boolean isTerminal() {
    return this == COMPLETE || this == FAILED;
  }

  /**
   * Checks whether a transition is legal: to the immediate successor, or to {@link #FAILED} from any
   * non-terminal state.
   *
   * @param next candidate next state
   * @return {@code true} when the transition is allowed
   */
  public boolean canTransitionTo(SessionState next) {
    if (isTerminal() || next == null) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return switch (this) {
      case IDLE -> next == SELECTING_BACKENDS;
      case SELECTING_BACKENDS -> next == ANALYZING;
      case ANALYZING -> next == FUSING;
      case FUSING -> next == RECOMMENDING;
      case RECOMMENDING -> next == COMPLETE;
      default -> false;
    };
  }
}
