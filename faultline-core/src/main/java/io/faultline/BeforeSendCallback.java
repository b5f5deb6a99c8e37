package io.faultline;

/**
 * Last look at an error or message event before it is handed to the transport.
 *
 * <p>Return the event (possibly a modified copy built via {@link Event#toBuilder()}) to send
 * it, or {@code null} to drop it. A callback that throws also drops the event.
 */
@FunctionalInterface
public interface BeforeSendCallback {

  /**
   * @param event the fully enriched event
   * @return the event to send, or {@code null} to drop it
   */
  Event beforeSend(Event event);
}
