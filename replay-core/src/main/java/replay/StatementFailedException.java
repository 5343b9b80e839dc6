package replay;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Terminal outcome of a statement that could not be applied after the retry loop gave up.
 *
 * <p>{@link #kind()} is the classification of the last observed error and
 * {@link #getCause()} is that error.
 *
 * @see IdempotentOutcomeException
 */
public class StatementFailedException extends ReplayException {
    private final ErrorKind kind;
    private final int attempts;

    public StatementFailedException(String message, SQLException cause, ErrorKind kind,
            int attempts, ErrorScope scope) {
        super(message, cause, scope);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.attempts = attempts;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the number of attempts made, including the failing one
     */
    public int attempts() {
        return attempts;
    }

    /**
     * @return vendor error code of the last observed error
     */
    public int errorCode() {
        return getCause().getErrorCode();
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
