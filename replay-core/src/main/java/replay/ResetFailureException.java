package replay;

/**
 * A lost connection could not be replaced. The cause is the recovery error, not the
 * statement error that triggered the recovery.
 */
public final class ResetFailureException extends ReplayException {
    public ResetFailureException(String message, Throwable cause, ErrorScope scope) {
        super(message, cause, scope);
    }
}
