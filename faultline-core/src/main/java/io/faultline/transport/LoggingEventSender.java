package io.faultline.transport;

import io.faultline.Event;

import java.util.logging.Logger;

/**
 * Debug sender: logs each envelope and reports success without touching the network.
 */
public final class LoggingEventSender implements EventSender {
  private static final Logger logger = Logger.getLogger(LoggingEventSender.class.getName());

  @Override
  public SendResponse send(Event event, String envelope) {
    logger.info("Event " + event.eventId() + ": " + envelope);
    return SendResponse.ok();
  }
}
