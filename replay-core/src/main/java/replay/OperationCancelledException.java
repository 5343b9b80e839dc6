package replay;

/**
 * The caller cancelled the operation or its deadline passed. Not a database fault.
 */
public final class OperationCancelledException extends ReplayException {
    public OperationCancelledException(String message, ErrorScope scope) {
        super(message, scope);
    }

    public OperationCancelledException(String message, Throwable cause, ErrorScope scope) {
        super(message, cause, scope);
    }
}
