/**
 * Retry budget, backoff shapes and the sequential retry loop.
 *
 * @see replay.retry.Retrier
 */
package replay.retry;
