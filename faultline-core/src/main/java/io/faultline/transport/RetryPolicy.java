package io.faultline.transport;

/**
 * Strategy for computing the delay before another delivery attempt of a failed event.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param failedAttempts number of attempts that have failed so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int failedAttempts);
}
