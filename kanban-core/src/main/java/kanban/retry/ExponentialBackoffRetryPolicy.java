package kanban.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}, then scaled by a
 * random factor in {@code [0.5, 1.5)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long capped = maxDelayMs;
    if (attempts < 63) {
      long factor = 1L << (attempts - 1);
      if (factor <= maxDelayMs / baseDelayMs) {
        capped = Math.min(maxDelayMs, baseDelayMs * factor);
      }
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
