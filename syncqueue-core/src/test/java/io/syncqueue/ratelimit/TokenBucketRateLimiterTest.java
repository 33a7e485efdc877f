package io.syncqueue.ratelimit;

import io.syncqueue.config.QueueConfig;
import io.syncqueue.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

  private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

  @Test
  void burstWithinSameInstantIsCappedAtCapacity() {
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(200, 100, clock);

    int allowed = 0;
    int denied = 0;
    for (int i = 0; i < 250; i++) {
      if (limiter.tryConsume()) {
        allowed++;
      } else {
        denied++;
      }
    }

    assertEquals(200, allowed);
    assertEquals(50, denied);
    assertEquals(0.1, limiter.refillPerMs(), 1e-9);
  }

  @Test
  void refillsProportionallyToElapsedTime() {
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(200, 100, clock);
    while (limiter.tryConsume()) {
      // drain
    }

    clock.advanceMillis(9);
    assertFalse(limiter.tryConsume(), "0.9 tokens should not be enough");

    clock.advanceMillis(1);
    assertTrue(limiter.tryConsume());
    assertFalse(limiter.tryConsume());
  }

  @Test
  void refillNeverExceedsCapacity() {
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10, 100, clock);
    limiter.tryConsume();

    clock.advanceMillis(60_000);

    assertEquals(10.0, limiter.availableTokens(), 1e-9);
  }

  @Test
  void sustainedRateConvergesToMaxPerSecond() {
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(5, 100, clock);
    while (limiter.tryConsume()) {
      // drain the initial burst
    }

    int allowed = 0;
    for (int ms = 0; ms < 10_000; ms++) {
      clock.advanceMillis(1);
      while (limiter.tryConsume()) {
        allowed++;
      }
    }

    assertTrue(allowed >= 999 && allowed <= 1000, "Expected ~1000 permits in 10s, got: " + allowed);
  }

  @Test
  void disabledSettingsYieldUnlimited() {
    RateLimiter limiter = TokenBucketRateLimiter.from(new QueueConfig.RateLimit(false, 1, 1), clock);

    assertSame(RateLimiter.UNLIMITED, limiter);
    for (int i = 0; i < 1000; i++) {
      assertTrue(limiter.tryConsume());
    }
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0, 1, clock));
    assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(1, 0, clock));
    assertThrows(NullPointerException.class, () -> new TokenBucketRateLimiter(1, 1, null));
  }
}
