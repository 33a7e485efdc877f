package io.syncqueue.dispatch;

import io.syncqueue.config.PriorityPolicy;

/**
 * Retry policy using exponential backoff without jitter.
 *
 * <p>Delay formula: {@code baseRetryDelayMs * 2^retryCount}, saturating at
 * {@code maxDelayMs}. With the default (no cap) the delay is strictly increasing in
 * {@code retryCount} until it saturates at {@link Long#MAX_VALUE}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long maxDelayMs;

  /** Creates an uncapped policy. */
  public ExponentialBackoffRetryPolicy() {
    this(Long.MAX_VALUE);
  }

  /**
   * @param maxDelayMs maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long maxDelayMs) {
    if (maxDelayMs <= 0) {
      throw new IllegalArgumentException("maxDelayMs must be > 0, got: " + maxDelayMs);
    }
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(PriorityPolicy policy, int retryCount) {
    long base = policy.baseRetryDelayMs();
    if (retryCount <= 0) {
      return Math.min(maxDelayMs, base);
    }
    long expDelay;
    if (retryCount >= 62) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << retryCount;
      // Guard against overflow: if shift exceeds MAX/base, saturate
      expDelay = shift > Long.MAX_VALUE / base ? Long.MAX_VALUE : base * shift;
    }
    return Math.min(maxDelayMs, expDelay);
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
