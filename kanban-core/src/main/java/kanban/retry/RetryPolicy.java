package kanban.retry;

/**
 * Strategy for computing the delay before resending a request that failed with a
 * retryable error.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param attempts the number of attempts made so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
