package io.faultline.transport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstRetryWaitsAboutBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 50 && delay < 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayDoublesPerFailedAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000, () -> 1.0);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(400, policy.computeDelayMs(3));
    assertEquals(800, policy.computeDelayMs(4));
  }

  @Test
  void jitterScalesTheBackoff() {
    assertEquals(50, new ExponentialBackoffRetryPolicy(100, 10000, () -> 0.5).computeDelayMs(1));
    assertEquals(125, new ExponentialBackoffRetryPolicy(100, 10000, () -> 1.25).computeDelayMs(1));
  }

  @Test
  void delayIsCappedAfterJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500, () -> 1.49);

    assertEquals(500, policy.computeDelayMs(3));
    assertEquals(500, policy.computeDelayMs(10));
  }

  @Test
  void handlesHugeAttemptCounts() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000, () -> 1.0);

    assertEquals(60000, policy.computeDelayMs(31));
    assertEquals(60000, policy.computeDelayMs(63));
    assertEquals(60000, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void noFailureMeansNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1000);

    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-3));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(500, 100));
  }

  @Test
  void exposesConfiguration() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(200, 30000);

    assertEquals(200, policy.baseDelayMs());
    assertEquals(30000, policy.maxDelayMs());
  }
}
