package replay;

import java.sql.SQLException;

/**
 * The statement failed because its effect is already in place: the object already
 * exists or the row is a duplicate. Usually the result of a prior, partially applied
 * attempt. Callers doing idempotent replay may treat it as success.
 */
public final class IdempotentOutcomeException extends StatementFailedException {
    public IdempotentOutcomeException(String message, SQLException cause, int attempts, ErrorScope scope) {
        super(message, cause, ErrorKind.IDEMPOTENT, attempts, scope);
    }
}
