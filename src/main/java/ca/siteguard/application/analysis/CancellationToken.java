package ca.siteguard.application.analysis;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation flag shared by a session and the backend tasks it launches.
 *
 * <p>Cancelling runs the registered callbacks once (typically {@code future.cancel(true)}); the session itself
 * notices at its next checkpoint.</p>
 *
 * @since SiteGuard 0.1
 */
public final class CancellationToken {
  private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

  private final AtomicReference<String> reason = new AtomicReference<>();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /**
   * Trips the token.
   *
   * @param why short reason recorded for diagnostics
   * @return {@code true} if this call cancelled the token, {@code false} if it was already cancelled
   */
  public boolean cancel(String why) {
    if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
      return false;
    }
    for (Runnable callback : callbacks) {
      runQuietly(callback);
    }
    return true;
  }

  public boolean isCancelled() {
    return reason.get() != null;
  }

  /**
   * Returns the cancellation reason.
   *
   * @return reason, or {@code null} while the token is live
   */
  public String reason() {
    return reason.get();
  }

  /**
   * Registers a callback run on cancellation; runs it immediately when already cancelled.
   *
   * @param callback action to run
   * @return handle removing the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    callbacks.add(callback);
    if (isCancelled() && callbacks.remove(callback)) {
      runQuietly(callback);
    }
    return () -> callbacks.remove(callback);
  }

  /**
   * Throws when the token has been cancelled.
   *
   * @throws CancellationException carrying the cancellation reason
   */
  public void throwIfCancelled() {
    String why = reason.get();
    if (why != null) {
      throw new CancellationException(why);
    }
  }

  private static void runQuietly(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException ex) {
      log.warn("Cancellation callback failed", ex);
    }
  }

  /** Removes a cancellation callback. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
