package io.syncqueue.ratelimit;

/**
 * Gate on dispatch throughput, consulted once per priority fetch attempt.
 *
 * @see TokenBucketRateLimiter
 */
public interface RateLimiter {

  /**
   * Limiter that always permits. Used when rate limiting is disabled.
   */
  RateLimiter UNLIMITED = new RateLimiter() {
    @Override
    public boolean tryConsume() {
      return true;
    }

    @Override
    public double availableTokens() {
      return Double.POSITIVE_INFINITY;
    }
  };

  /**
   * Takes one permit if available.
   *
   * @return {@code true} if the caller may proceed
   */
  boolean tryConsume();

  /**
   * Current token count, for status reporting.
   */
  double availableTokens();
}
