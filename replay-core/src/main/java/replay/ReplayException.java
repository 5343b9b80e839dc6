package replay;

import java.util.Objects;

/**
 * Base of all unchecked exceptions surfaced by the replay layer.
 *
 * <p>Every instance carries the {@link ErrorScope} of the failing side.
 */
public class ReplayException extends RuntimeException {
    private final ErrorScope scope;

    public ReplayException(String message, ErrorScope scope) {
        super(message);
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public ReplayException(String message, Throwable cause, ErrorScope scope) {
        super(message, cause);
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public ErrorScope scope() {
        return scope;
    }
}
