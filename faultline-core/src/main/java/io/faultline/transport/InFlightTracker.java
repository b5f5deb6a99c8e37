package io.faultline.transport;

/**
 * Counts events a transport accepted but has not finished with, and lets callers wait
 * until none are left.
 */
public interface InFlightTracker {

  /**
   * Registers an accepted event.
   *
   * @param eventId id of the event
   */
  void begin(String eventId);

  /**
   * Marks an event as finished, whatever its outcome.
   *
   * @param eventId id of the event
   */
  void end(String eventId);

  int pending();

  /**
   * Blocks until {@link #pending()} reaches zero or the timeout elapses.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if nothing is pending
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitDrained(long timeoutMs) throws InterruptedException;
}
