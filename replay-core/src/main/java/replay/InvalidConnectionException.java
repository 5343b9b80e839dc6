package replay;

/**
 * Thrown when an operation is invoked on a connection that has no underlying handle.
 * No I/O is attempted.
 */
public final class InvalidConnectionException extends ReplayException {
    public InvalidConnectionException(String message) {
        super(message, ErrorScope.NOT_SET);
    }
}
