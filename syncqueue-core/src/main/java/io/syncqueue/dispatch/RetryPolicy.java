package io.syncqueue.dispatch;

import io.syncqueue.config.PriorityPolicy;

/**
 * Strategy for computing the delay before retrying a failed event.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param policy     the event's priority policy
   * @param retryCount retries already consumed (0 for the first failure)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(PriorityPolicy policy, int retryCount);
}
