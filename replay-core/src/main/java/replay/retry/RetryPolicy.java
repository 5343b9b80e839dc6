package replay.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry budget: maximum attempts, first delay and backoff shape.
 *
 * @see Retrier
 */
public final class RetryPolicy {

  /** Budget used by queries: 10 attempts, 1s apart. */
  public static final RetryPolicy QUERY_DEFAULT =
      new RetryPolicy(10, Duration.ofSeconds(1), BackoffStrategy.STABLE);

  /** Budget used by statement batches: 10 attempts, 2s, 4s, 6s, ... apart. */
  public static final RetryPolicy EXECUTE_DEFAULT =
      new RetryPolicy(10, Duration.ofSeconds(2), BackoffStrategy.LINEAR_INCREASE);

  private final int maxAttempts;
  private final long firstDelayMs;
  private final BackoffStrategy backoff;

  /**
   * @param maxAttempts total attempts including the first one; must be &ge; 1
   * @param firstDelay  delay before the first retry; must not be negative
   * @param backoff     growth of the delay over attempts
   */
  public RetryPolicy(int maxAttempts, Duration firstDelay, BackoffStrategy backoff) {
    Objects.requireNonNull(firstDelay, "firstDelay");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (firstDelay.isNegative()) {
      throw new IllegalArgumentException("firstDelay must be >= 0, got: " + firstDelay);
    }
    this.maxAttempts = maxAttempts;
    this.firstDelayMs = firstDelay.toMillis();
  }

  public static RetryPolicy stable(int maxAttempts, Duration firstDelay) {
    return new RetryPolicy(maxAttempts, firstDelay, BackoffStrategy.STABLE);
  }

  public static RetryPolicy linear(int maxAttempts, Duration firstDelay) {
    return new RetryPolicy(maxAttempts, firstDelay, BackoffStrategy.LINEAR_INCREASE);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration firstDelay() {
    return Duration.ofMillis(firstDelayMs);
  }

  public BackoffStrategy backoff() {
    return backoff;
  }

  /**
   * Computes the delay in milliseconds to wait after a failed attempt.
   *
   * @param attempts the number of attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    return backoff.delayMs(firstDelayMs, attempts);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryPolicy other)) return false;
    return maxAttempts == other.maxAttempts
        && firstDelayMs == other.firstDelayMs
        && backoff == other.backoff;
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxAttempts, firstDelayMs, backoff);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", firstDelayMs=" + firstDelayMs
        + ", backoff=" + backoff + '}';
  }
}
