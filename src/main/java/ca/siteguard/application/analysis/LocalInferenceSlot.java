package ca.siteguard.application.analysis;

import ca.siteguard.domain.session.SubmissionKind;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Exclusive, priority-aware access to on-device inference.
 * <p><strong>Why:</strong> The device can run one local model invocation at a time. Photos must not wait behind
 * queued stream frames.</p>
 * <p><strong>Role:</strong> Shared by every local backend call the orchestrator makes.</p>
 * <p><strong>Policy:</strong> Waiters are served FIFO within their class; any waiting photo is granted before any
 * waiting frame. Waiters re-check their cancellation token at a fixed checkpoint interval and leave the queue
 * when cancelled or when their wait deadline passes.</p>
 * <p><strong>Thread-safety:</strong> Guarded by a {@link ReentrantLock}; leases may be closed from any thread and
 * closing is idempotent.</p>
 *
 * @since SiteGuard 0.1
 */
public final class LocalInferenceSlot {
  /** Default interval at which waiters check for cancellation. */
  public static final long DEFAULT_CHECKPOINT_MILLIS = 25L;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Deque<Waiter> photoQueue = new ArrayDeque<>();
  private final Deque<Waiter> frameQueue = new ArrayDeque<>();
  private final long checkpointMillis;
  private Lease current;

  public LocalInferenceSlot() {
    this(DEFAULT_CHECKPOINT_MILLIS);
  }

  public LocalInferenceSlot(long checkpointMillis) {
    if (checkpointMillis <= 0L) {
      throw new IllegalArgumentException("checkpointMillis must be positive");
    }
    this.checkpointMillis = checkpointMillis;
  }

  /**
   * Blocks until the slot is granted to the caller.
   *
   * @param kind priority class of the request
   * @param token cancellation token checked while waiting
   * @return lease that must be closed when inference finishes
   * @throws CancellationException when the token is cancelled while waiting
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public Lease acquire(SubmissionKind kind, CancellationToken token) throws InterruptedException {
    try {
      return await(kind, token, Long.MAX_VALUE);
    } catch (TimeoutException ex) {
      throw new IllegalStateException("unbounded wait timed out", ex);
    }
  }

  /**
   * Waits at most {@code timeout} for the slot.
   *
   * @param kind priority class of the request
   * @param token cancellation token checked while waiting
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return lease that must be closed when inference finishes
   * @throws TimeoutException when the slot is still held by another call once the wait expires
   * @throws CancellationException when the token is cancelled while waiting
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public Lease acquire(SubmissionKind kind, CancellationToken token, long timeout, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    Objects.requireNonNull(unit, "unit");
    return await(kind, token, Math.max(0L, unit.toNanos(timeout)));
  }

  private Lease await(SubmissionKind kind, CancellationToken token, long timeoutNanos)
      throws InterruptedException, TimeoutException {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(token, "token");
    long startNanos = System.nanoTime();
    long checkpointNanos = TimeUnit.MILLISECONDS.toNanos(checkpointMillis);
    Waiter waiter = new Waiter(kind);
    lock.lock();
    try {
      queueFor(kind).addLast(waiter);
      boolean granted = false;
      try {
        while (!isNext(waiter)) {
          token.throwIfCancelled();
          long remaining = timeoutNanos - (System.nanoTime() - startNanos);
          if (remaining <= 0L) {
            throw new TimeoutException(
                "local inference busy for " + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms");
          }
          changed.awaitNanos(Math.min(remaining, checkpointNanos));
        }
        token.throwIfCancelled();
        granted = true;
      } finally {
        queueFor(kind).remove(waiter);
        if (!granted) {
          changed.signalAll();
        }
      }
      current = new Lease(kind);
      return current;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether inference is in progress.
   *
   * @return {@code true} while a lease is held
   */
  public boolean isHeld() {
    lock.lock();
    try {
      return current != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of requests waiting in a priority class.
   *
   * @param kind priority class
   * @return queued request count
   */
  public int queued(SubmissionKind kind) {
    lock.lock();
    try {
      return queueFor(kind).size();
    } finally {
      lock.unlock();
    }
  }

  private boolean isNext(Waiter waiter) {
    if (current != null) {
      return false;
    }
    if (!photoQueue.isEmpty()) {
      return photoQueue.peekFirst() == waiter;
    }
    return frameQueue.peekFirst() == waiter;
  }

  private Deque<Waiter> queueFor(SubmissionKind kind) {
    return kind == SubmissionKind.PHOTO ? photoQueue : frameQueue;
  }

  private void release(Lease lease) {
    lock.lock();
    try {
      if (current == lease) {
        current = null;
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private static final class Waiter {
    private final SubmissionKind kind;

    private Waiter(SubmissionKind kind) {
      this.kind = kind;
    }

    @Override
    public String toString() {
      return "Waiter{" + kind + '}';
    }
  }

  /** Scoped ownership of the slot; closing more than once has no further effect. */
  public final class Lease implements AutoCloseable {
    private final SubmissionKind kind;
    private final AtomicBoolean released = new AtomicBoolean();

    private Lease(SubmissionKind kind) {
      this.kind = kind;
    }

    public SubmissionKind kind() {
      return kind;
    }

    public boolean isReleased() {
      return released.get();
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        release(this);
      }
    }
  }
}
