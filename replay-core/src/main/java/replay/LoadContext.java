package replay;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellation and deadline signal carried by every replay operation.
 *
 * <p>A context is cancelled either explicitly through {@link #cancel()} or implicitly once
 * its deadline passes. Blocking waits performed through {@link #sleep(long, ErrorScope)} return as soon
 * as the context is cancelled, and hooks registered with {@link #onCancel(Runnable)} run
 * on the cancelling thread so that in-flight JDBC statements can be aborted.
 *
 * <p>Cancelling a context also cancels every child derived from it.
 *
 * <p>This class is thread-safe.
 */
public final class LoadContext {
  private static final Logger logger = Logger.getLogger(LoadContext.class.getName());

  private final Instant deadline;
  private final CountDownLatch done = new CountDownLatch(1);
  private final List<Runnable> hooks = new CopyOnWriteArrayList<>();
  private volatile String reason;

  private LoadContext(Instant deadline) {
    this.deadline = deadline;
  }

  /** A context that is never cancelled unless {@link #cancel()} is called. */
  public static LoadContext background() {
    return new LoadContext(null);
  }

  /** A context cancelled automatically once {@code timeout} has elapsed. */
  public static LoadContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return new LoadContext(Instant.now().plus(timeout));
  }

  /**
   * Derives a child context with an additional timeout. The child ends at the earlier
   * of both deadlines and is cancelled together with this context. Once the child is
   * cancelled it no longer holds a hook on this context.
   */
  public LoadContext childWithTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    Instant childDeadline = Instant.now().plus(timeout);
    if (deadline != null && deadline.isBefore(childDeadline)) {
      childDeadline = deadline;
    }
    LoadContext child = new LoadContext(childDeadline);
    Registration link = onCancel(() -> child.cancel(reason));
    child.onCancel(link::close);
    if (isCancelled()) {
      child.cancel(reason);
    }
    return child;
  }

  public void cancel() {
    cancel("context canceled");
  }

  private void cancel(String why) {
    synchronized (done) {
      if (done.getCount() == 0) {
        return;
      }
      reason = why;
      done.countDown();
    }
    for (Runnable hook : hooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Cancellation hook failed", e);
      }
    }
  }

  /**
   * @return {@code true} once {@link #cancel()} was called or the deadline has passed
   */
  public boolean isCancelled() {
    if (done.getCount() == 0) {
      return true;
    }
    if (deadline != null && !Instant.now().isBefore(deadline)) {
      cancel("context deadline exceeded");
      return true;
    }
    return false;
  }

  /**
   * @return why the context ended, or {@code null} while it is still live
   */
  public String reason() {
    return isCancelled() ? reason : null;
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * @return time left before the deadline; empty when the context has no deadline
   */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(Instant.now(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Throws {@link OperationCancelledException} if the context is no longer live.
   *
   * @param scope scope attached to the thrown exception
   */
  public void throwIfCancelled(ErrorScope scope) {
    if (isCancelled()) {
      throw new OperationCancelledException(reason, scope);
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new OperationCancelledException("thread interrupted", scope);
    }
  }

  /**
   * Blocks the calling thread for {@code delayMs}, returning early if the context is
   * cancelled, its deadline passes, or the thread is interrupted.
   *
   * @param delayMs delay in milliseconds
   * @param scope   scope attached to the thrown exception
   * @throws OperationCancelledException if the wait ended because of cancellation
   */
  public void sleep(long delayMs, ErrorScope scope) {
    long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, delayMs));
    while (true) {
      throwIfCancelled(scope);
      long waitNs = until - System.nanoTime();
      if (waitNs <= 0) {
        return;
      }
      Optional<Duration> left = remaining();
      if (left.isPresent() && left.get().compareTo(Duration.ofNanos(waitNs)) < 0) {
        waitNs = left.get().toNanos();
      }
      try {
        if (done.await(waitNs, TimeUnit.NANOSECONDS)) {
          throw new OperationCancelledException(reason, scope);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new OperationCancelledException("thread interrupted", e, scope);
      }
    }
  }

  /**
   * Registers a hook to run when the context is cancelled. If the context is already
   * cancelled the hook runs immediately.
   *
   * @return a registration that removes the hook when closed
   */
  public Registration onCancel(Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    hooks.add(hook);
    if (done.getCount() == 0) {
      hooks.remove(hook);
      hook.run();
    }
    return () -> hooks.remove(hook);
  }

  int pendingHooks() {
    return hooks.size();
  }

  /** Handle returned by {@link #onCancel(Runnable)}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
