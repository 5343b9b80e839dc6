package replay.retry;

/**
 * Shape of the delay between two attempts.
 */
public enum BackoffStrategy {
  /** Constant delay: every retry waits the first delay. */
  STABLE {
    @Override
    long delayMs(long firstDelayMs, int attempts) {
      return firstDelayMs;
    }
  },
  /** Delay grows with the attempt index: {@code firstDelay * attempts}. */
  LINEAR_INCREASE {
    @Override
    long delayMs(long firstDelayMs, int attempts) {
      if (attempts > Long.MAX_VALUE / Math.max(1L, firstDelayMs)) {
        return Long.MAX_VALUE;
      }
      return firstDelayMs * attempts;
    }
  };

  abstract long delayMs(long firstDelayMs, int attempts);
}
