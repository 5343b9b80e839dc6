package replay;

/**
 * Raised when a connection pool cannot be constructed. No connection survives it.
 */
public final class ConnectionPoolException extends ReplayException {
    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause, ErrorScope.DOWNSTREAM);
    }
}
