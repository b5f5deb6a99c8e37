package io.faultline.transport;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Monitor-based in-flight tracker.
 *
 * <p>The same event id may be registered more than once (a caller resending an event); each
 * {@link #begin(String)} needs its own {@link #end(String)}.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Integer> inflight = new HashMap<>();
  private int pending;

  @Override
  public synchronized void begin(String eventId) {
    inflight.merge(eventId, 1, Integer::sum);
    pending++;
  }

  @Override
  public synchronized void end(String eventId) {
    Integer count = inflight.get(eventId);
    if (count == null) {
      return;
    }
    if (count == 1) {
      inflight.remove(eventId);
    } else {
      inflight.put(eventId, count - 1);
    }
    pending--;
    if (pending == 0) {
      notifyAll();
    }
  }

  @Override
  public synchronized int pending() {
    return pending;
  }

  public synchronized boolean isInFlight(String eventId) {
    return inflight.containsKey(eventId);
  }

  @Override
  public synchronized boolean awaitDrained(long timeoutMs) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
    while (pending > 0) {
      long remainingNanos = deadline - System.nanoTime();
      if (remainingNanos <= 0) {
        return false;
      }
      TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
    }
    return true;
  }
}
