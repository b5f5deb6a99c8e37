package io.faultline.transport;

import io.faultline.Event;

import java.io.IOException;

/**
 * Performs one delivery attempt of a serialized event.
 *
 * <p>Implementations must be thread-safe; {@link AsyncTransport} calls them from all of its
 * workers. Retries, rate limits and outcome bookkeeping belong to the transport.
 *
 * @see HttpEventSender
 * @see LoggingEventSender
 */
public interface EventSender extends AutoCloseable {

  /**
   * Sends one envelope.
   *
   * @param event    the event being sent, for logging
   * @param envelope the event serialized as JSON
   * @return the collector's answer
   * @throws IOException if no answer was received
   */
  SendResponse send(Event event, String envelope) throws IOException;

  @Override
  default void close() {
  }
}
