package io.syncqueue.ratelimit;

import io.syncqueue.config.QueueConfig;

import java.time.Clock;
import java.util.Objects;

/**
 * Token bucket that refills continuously at {@code maxPerSecond} up to
 * {@code burstCapacity}, starting full.
 *
 * <p>Refill and consume happen under one lock, so concurrent callers never observe a
 * torn token count. This class is thread-safe.
 */
public final class TokenBucketRateLimiter implements RateLimiter {
  private final double capacity;
  private final double refillPerMs;
  private final Clock clock;

  private double tokens;
  private long lastRefillAt;

  public TokenBucketRateLimiter(int burstCapacity, double maxPerSecond) {
    this(burstCapacity, maxPerSecond, Clock.systemUTC());
  }

  /**
   * @param burstCapacity maximum tokens held; also the initial token count
   * @param maxPerSecond  sustained refill rate
   * @param clock         time source for refill computation
   */
  public TokenBucketRateLimiter(int burstCapacity, double maxPerSecond, Clock clock) {
    if (burstCapacity <= 0) {
      throw new IllegalArgumentException("burstCapacity must be > 0, got: " + burstCapacity);
    }
    if (maxPerSecond <= 0) {
      throw new IllegalArgumentException("maxPerSecond must be > 0, got: " + maxPerSecond);
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.capacity = burstCapacity;
    this.refillPerMs = maxPerSecond / 1000.0;
    this.tokens = burstCapacity;
    this.lastRefillAt = clock.millis();
  }

  /**
   * Builds the limiter described by {@code settings}, or {@link RateLimiter#UNLIMITED}
   * when rate limiting is disabled.
   */
  public static RateLimiter from(QueueConfig.RateLimit settings, Clock clock) {
    if (!settings.enabled()) {
      return RateLimiter.UNLIMITED;
    }
    return new TokenBucketRateLimiter(settings.burstCapacity(), settings.maxPerSecond(), clock);
  }

  @Override
  public synchronized boolean tryConsume() {
    refill();
    if (tokens >= 1.0) {
      tokens -= 1.0;
      return true;
    }
    return false;
  }

  @Override
  public synchronized double availableTokens() {
    refill();
    return tokens;
  }

  public double capacity() {
    return capacity;
  }

  public double refillPerMs() {
    return refillPerMs;
  }

  private void refill() {
    long now = clock.millis();
    long elapsed = now - lastRefillAt;
    // Clock moved backwards: keep tokens, re-anchor
    if (elapsed > 0) {
      tokens = Math.min(capacity, tokens + elapsed * refillPerMs);
    }
    lastRefillAt = now;
  }
}
