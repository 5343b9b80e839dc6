package replay.spi;

import replay.ErrorKind;

/**
 * Maps a raw driver error to an {@link ErrorKind}.
 *
 * <p>Implementations must be pure: classification never touches the connection,
 * the network, or any shared state. Recovery decisions are taken by the retry loop
 * from the returned kind.
 *
 * @see replay.retry.RetryAction
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param error the error raised by an attempt, never {@code null}
     * @return the classification; {@link ErrorKind#FATAL} when nothing more specific applies
     */
    ErrorKind classify(Throwable error);
}
