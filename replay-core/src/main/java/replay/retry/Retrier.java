package replay.retry;

import replay.ErrorKind;
import replay.ErrorScope;
import replay.IdempotentOutcomeException;
import replay.LoadContext;
import replay.OperationCancelledException;
import replay.ResetFailureException;
import replay.StatementFailedException;
import replay.spi.ErrorClassifier;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Sequential retry loop driven by a {@link RetryPolicy} and an {@link ErrorClassifier}.
 *
 * <p>Each failed attempt is classified, mapped to a {@link RetryAction} and dispatched:
 * <ul>
 *   <li>{@link RetryAction#RECOVER_THEN_RETRY} invokes the {@link Recovery}; if recovery
 *       fails the loop stops with a {@link ResetFailureException} carrying the recovery
 *       error.</li>
 *   <li>{@link RetryAction#RETRY} waits and tries again.</li>
 *   <li>{@link RetryAction#FAIL} stops immediately.</li>
 * </ul>
 * Once the budget is used up the last error is surfaced as a
 * {@link StatementFailedException}. A cancelled {@link LoadContext} ends the loop with an
 * {@link OperationCancelledException} and never triggers a recovery.
 *
 * <p>Everything runs on the calling thread; the inter-attempt delay is a blocking wait
 * on the context.
 */
public final class Retrier {
  private final RetryPolicy policy;
  private final ErrorClassifier classifier;
  private final ErrorScope scope;

  public Retrier(RetryPolicy policy, ErrorClassifier classifier, ErrorScope scope) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.scope = Objects.requireNonNull(scope, "scope");
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs {@code attempt} until it succeeds or the loop reaches a terminal failure.
   *
   * @param ctx      cancellation signal
   * @param attempt  the unit of work; re-run from the start on every retry
   * @param recovery replaces the underlying connection after a connection loss
   * @param listener observer of failures and retries
   * @return the result of the first successful attempt
   * @throws StatementFailedException    if the attempt failed terminally
   * @throws ResetFailureException       if a lost connection could not be replaced
   * @throws OperationCancelledException if {@code ctx} was cancelled
   */
  public <T> T call(LoadContext ctx, Attempt<T> attempt, Recovery recovery, Listener listener) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(attempt, "attempt");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(listener, "listener");

    for (int attempts = 1; ; attempts++) {
      ctx.throwIfCancelled(scope);
      try {
        return attempt.run(ctx);
      } catch (SQLException e) {
        listener.onAttemptFailed(attempts, e);
        if (ctx.isCancelled() || Thread.currentThread().isInterrupted()) {
          throw new OperationCancelledException(cancelReason(ctx), e, scope);
        }

        ErrorKind kind = classifier.classify(e);
        RetryAction action = RetryAction.of(kind);
        if (action == RetryAction.FAIL) {
          throw terminal(kind, attempts, e);
        }
        if (action == RetryAction.RECOVER_THEN_RETRY) {
          try {
            recovery.recover(ctx);
          } catch (SQLException | RuntimeException re) {
            listener.onRecoveryFailed(attempts, re);
            throw new ResetFailureException("reset connection failed", re, scope);
          }
        }
        if (attempts >= policy.maxAttempts()) {
          throw terminal(kind, attempts, e);
        }
        listener.onRetry(attempts, kind, e);
        ctx.sleep(policy.computeDelayMs(attempts), scope);
      }
    }
  }

  private StatementFailedException terminal(ErrorKind kind, int attempts, SQLException e) {
    if (kind == ErrorKind.IDEMPOTENT) {
      return new IdempotentOutcomeException(e.getMessage(), e, attempts, scope);
    }
    return new StatementFailedException(e.getMessage(), e, kind, attempts, scope);
  }

  private static String cancelReason(LoadContext ctx) {
    String reason = ctx.reason();
    return reason != null ? reason : "thread interrupted";
  }

  /** One attempt of the retried operation. */
  @FunctionalInterface
  public interface Attempt<T> {
    T run(LoadContext ctx) throws SQLException;
  }

  /** Replaces the underlying connection after a connection loss. */
  @FunctionalInterface
  public interface Recovery {
    /** Recovery for operations that never lose their connection. */
    Recovery NONE = ctx -> {
      throw new SQLException("connection recovery is not supported");
    };

    void recover(LoadContext ctx) throws SQLException;
  }

  /** Observer of the retry loop, used for logging and metrics. */
  public interface Listener {
    Listener NONE = new Listener() {
    };

    /** Called for every failed attempt, before classification. */
    default void onAttemptFailed(int attempts, SQLException error) {
    }

    /** Called when the loop is about to wait and retry. */
    default void onRetry(int attempts, ErrorKind kind, SQLException error) {
    }

    /** Called when the recovery of a lost connection failed. */
    default void onRecoveryFailed(int attempts, Exception error) {
    }
  }
}
