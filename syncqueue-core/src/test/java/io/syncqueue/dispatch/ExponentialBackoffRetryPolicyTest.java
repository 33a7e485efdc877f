package io.syncqueue.dispatch;

import io.syncqueue.config.PriorityPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  private static final PriorityPolicy CRITICAL = new PriorityPolicy(5, 1000, 30_000);

  @Test
  void firstRetryReturnsBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(1000, policy.computeDelayMs(CRITICAL, 0));
  }

  @Test
  void delayDoublesWithEachRetry() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(2000, policy.computeDelayMs(CRITICAL, 1));
    assertEquals(4000, policy.computeDelayMs(CRITICAL, 2));
    assertEquals(8000, policy.computeDelayMs(CRITICAL, 3));
    assertEquals(16000, policy.computeDelayMs(CRITICAL, 4));
  }

  @Test
  void delayIsStrictlyIncreasingUntilSaturation() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();
    PriorityPolicy low = new PriorityPolicy(2, 10_000, 10_000);

    long previous = policy.computeDelayMs(low, 0);
    for (int n = 1; n < 40; n++) {
      long delay = policy.computeDelayMs(low, n);
      assertTrue(delay > previous, "delay(" + n + ")=" + delay + " <= delay(" + (n - 1) + ")=" + previous);
      previous = delay;
    }
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(5000);

    assertEquals(4000, policy.computeDelayMs(CRITICAL, 2));
    assertEquals(5000, policy.computeDelayMs(CRITICAL, 3));
    assertEquals(5000, policy.computeDelayMs(CRITICAL, 30));
  }

  @Test
  void saturatesInsteadOfOverflowing() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(Long.MAX_VALUE, policy.computeDelayMs(CRITICAL, 62));
    assertEquals(Long.MAX_VALUE, policy.computeDelayMs(CRITICAL, 100));
    assertTrue(policy.computeDelayMs(CRITICAL, 53) > 0);
  }

  @Test
  void invalidMaxDelayThrows() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0));
  }
}
