package io.faultline.transport;

import io.faultline.Event;

import java.util.concurrent.CompletableFuture;

/**
 * Hands finished events to the collector.
 *
 * <p>{@link #sendEvent(Event)} must not block the caller: it accepts the event (or rejects it
 * immediately) and completes the returned future when delivery reaches a terminal outcome.
 *
 * @see AsyncTransport
 */
public interface Transport extends AutoCloseable {

  /**
   * Accepts an event for delivery.
   *
   * @param event the event, already carrying its id
   * @return completes with the delivery outcome; never completes exceptionally
   */
  CompletableFuture<DeliveryOutcome> sendEvent(Event event);

  /**
   * Waits until every accepted event reached a terminal outcome.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if nothing was pending at return, {@code false} on timeout
   */
  boolean flush(long timeoutMs);

  /**
   * Stops accepting events. Deliveries already accepted keep running on their own threads.
   */
  @Override
  void close();
}
