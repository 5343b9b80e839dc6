package replay;

/**
 * Classification of a failure raised by the target database.
 *
 * @see replay.spi.ErrorClassifier
 */
public enum ErrorKind {
    /** The underlying connection is unusable and must be replaced before retrying. */
    CONNECTION_LOST,
    /** A transient statement condition (lock wait timeout, deadlock victim, ...). */
    RETRYABLE,
    /** Non-retryable and not idempotent. */
    FATAL,
    /** "Already exists" or "duplicate key": the intended end state already holds. */
    IDEMPOTENT
}
