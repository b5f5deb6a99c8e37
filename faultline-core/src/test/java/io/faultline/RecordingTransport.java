package io.faultline;

import io.faultline.transport.DeliveryOutcome;
import io.faultline.transport.Transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that keeps every event in memory and reports it as sent.
 */
class RecordingTransport implements Transport {
  final List<Event> events = new CopyOnWriteArrayList<>();
  final AtomicInteger flushCalls = new AtomicInteger();
  final AtomicBoolean closed = new AtomicBoolean();
  volatile boolean flushResult = true;

  @Override
  public CompletableFuture<DeliveryOutcome> sendEvent(Event event) {
    if (closed.get()) {
      return CompletableFuture.completedFuture(DeliveryOutcome.DROPPED_CLOSED);
    }
    events.add(event);
    return CompletableFuture.completedFuture(DeliveryOutcome.SENT);
  }

  @Override
  public boolean flush(long timeoutMs) {
    flushCalls.incrementAndGet();
    return flushResult;
  }

  @Override
  public void close() {
    closed.set(true);
  }

  Event only() {
    if (events.size() != 1) {
      throw new AssertionError("expected exactly one event, got " + events.size());
    }
    return events.get(0);
  }
}
