/**
 * Delivery of finished events to the collector.
 *
 * <p>{@link io.faultline.transport.AsyncTransport} queues events and delivers them on daemon
 * workers through an {@link io.faultline.transport.EventSender}, with retry on server and
 * network errors, per-category rate limiting and a drain wait for flush.
 *
 * @see io.faultline.transport.Transport
 * @see io.faultline.transport.AsyncTransport
 * @see io.faultline.transport.RateLimiter
 * @see io.faultline.transport.RetryPolicy
 */
package io.faultline.transport;
