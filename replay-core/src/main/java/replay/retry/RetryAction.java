package replay.retry;

import replay.ErrorKind;

/**
 * What the retry loop does after a failed attempt.
 */
public enum RetryAction {
  /** Wait, then run the attempt again on the same connection. */
  RETRY,
  /** Replace the underlying connection, wait, then run the attempt again. */
  RECOVER_THEN_RETRY,
  /** Stop and surface the error. */
  FAIL;

  /**
   * Decision table from classification to action.
   */
  public static RetryAction of(ErrorKind kind) {
    return switch (kind) {
      case CONNECTION_LOST -> RECOVER_THEN_RETRY;
      case RETRYABLE -> RETRY;
      case FATAL, IDEMPOTENT -> FAIL;
    };
  }
}
