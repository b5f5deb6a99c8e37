package io.faultline.transport;

/**
 * Terminal result of handing one event to a {@link Transport}.
 */
public enum DeliveryOutcome {
  /** The collector accepted the event. */
  SENT,
  /** The delivery queue was full when the event arrived. */
  DROPPED_QUEUE_FULL,
  /** The transport had been closed. */
  DROPPED_CLOSED,
  /** The event's category was cooling down after a 429. */
  DROPPED_RATE_LIMITED,
  /** The collector rejected the event with a 4xx other than 429. */
  DROPPED_CLIENT_ERROR,
  /** Every attempt failed with a 5xx or an I/O error. */
  DROPPED_RETRIES_EXHAUSTED,
  /** The event could not be turned into JSON. */
  DROPPED_SERIALIZATION;

  public boolean isSent() {
    return this == SENT;
  }
}
