package ca.siteguard.application.analysis;

import ca.siteguard.domain.session.AnalysisSession;
import ca.siteguard.domain.session.SubmissionKind;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a session running asynchronously.
 *
 * <p>The future always completes normally with an {@link AnalysisSession}; cancellation surfaces as a session in
 * the FAILED state rather than as an exceptional completion.</p>
 *
 * @since SiteGuard 0.1
 */
public final class AnalysisHandle {
  private final String correlationId;
  private final SubmissionKind kind;
  private final CompletableFuture<AnalysisSession> result;
  private final CancellationToken token;

  AnalysisHandle(
      String correlationId,
      SubmissionKind kind,
      CompletableFuture<AnalysisSession> result,
      CancellationToken token) {
    this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.result = Objects.requireNonNull(result, "result");
    this.token = Objects.requireNonNull(token, "token");
  }

  public String correlationId() {
    return correlationId;
  }

  public SubmissionKind kind() {
    return kind;
  }

  /**
   * Returns a view of the result that callers may compose but not complete.
   *
   * @return result stage
   */
  public CompletableFuture<AnalysisSession> future() {
    return result.copy();
  }

  /**
   * Blocks until the session is finalized.
   *
   * @return finalized session
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public AnalysisSession await() throws InterruptedException {
    try {
      return result.get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("analysis session " + correlationId + " failed unexpectedly", ex.getCause());
    }
  }

  /**
   * Blocks until the session is finalized or the timeout elapses.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return finalized session
   * @throws InterruptedException when the waiting thread is interrupted
   * @throws TimeoutException when the session is still running
   */
  public AnalysisSession await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
    try {
      return result.get(timeout, unit);
    } catch (ExecutionException ex) {
      throw new IllegalStateException("analysis session " + correlationId + " failed unexpectedly", ex.getCause());
    }
  }

  /**
   * Requests cooperative cancellation. The session ends FAILED with kind CANCELLED unless it already finished.
   *
   * @return {@code true} if this call tripped the cancellation token
   */
  public boolean cancel() {
    return token.cancel("cancelled by caller");
  }

  public boolean isDone() {
    return result.isDone();
  }

  CancellationToken token() {
    return token;
  }
}
