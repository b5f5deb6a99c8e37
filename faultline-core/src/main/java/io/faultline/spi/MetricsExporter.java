package io.faultline.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted into the delivery queue.
     */
    void incrementEnqueued();

    /**
     * Increments the count of events rejected because the delivery queue was full.
     */
    void incrementQueueFull();

    /**
     * Increments the count of events the collector accepted.
     */
    void incrementSent();

    /**
     * Increments the count of failed attempts that were scheduled for another try.
     */
    void incrementRetried();

    /**
     * Increments the count of events given up on after the queue accepted them
     * (client errors, exhausted retries, serialization failures).
     */
    void incrementDropped();

    /**
     * Increments the count of events dropped because their category was rate limited.
     */
    default void incrementRateLimited() {
    }

    /**
     * Increments the count of events discarded by the capture pipeline before they reached
     * the transport: sampled out, ignored, or rejected by a before-send callback.
     *
     * @param reason short lowercase reason, e.g. {@code "sample_rate"}
     */
    default void incrementDroppedBeforeTransport(String reason) {
    }

    /**
     * Records the current depth of the delivery queue.
     *
     * @param depth number of queued events
     */
    void recordQueueDepth(int depth);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementQueueFull() {
        }

        @Override
        public void incrementSent() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
