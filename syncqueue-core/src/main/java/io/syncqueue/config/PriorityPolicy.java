package io.syncqueue.config;

/**
 * Retry limit, backoff base and processing deadline for one priority level.
 *
 * @param maxRetries       retries allowed before an event is dead-lettered
 * @param baseRetryDelayMs delay before the first retry; doubled on each further retry
 * @param timeoutMs        deadline for a single processor call
 */
public record PriorityPolicy(int maxRetries, long baseRetryDelayMs, long timeoutMs) {

  public PriorityPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    if (baseRetryDelayMs <= 0) {
      throw new IllegalArgumentException("baseRetryDelayMs must be > 0, got: " + baseRetryDelayMs);
    }
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
    }
  }
}
