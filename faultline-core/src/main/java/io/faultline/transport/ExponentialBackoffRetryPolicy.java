package io.faultline.transport;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay: {@code baseDelay * 2^(failedAttempts-1)}, capped at {@code maxDelay}, then
 * multiplied by a jitter factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final DoubleSupplier jitter;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
  }

  ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, DoubleSupplier jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long backoff = maxDelayMs;
    if (failedAttempts < 63) {
      long factor = 1L << (failedAttempts - 1);
      if (factor <= maxDelayMs / baseDelayMs) {
        backoff = baseDelayMs * factor;
      }
    }
    long jittered = (long) (backoff * jitter.getAsDouble());
    return Math.min(maxDelayMs, Math.max(0L, jittered));
  }
}
