package io.recall.retry;

/**
 * Computes the delay before the next attempt after a retryable failure.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts number of failed attempts so far (1 for the first failure)
   * @return delay in milliseconds before the next attempt; never negative
   */
  long computeDelayMs(int attempts);
}
