package io.faultline.transport;

import io.faultline.Event;
import io.faultline.spi.MetricsExporter;
import io.faultline.util.DaemonThreadFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Transport}: a bounded queue drained by daemon worker threads.
 *
 * <p>{@link #sendEvent(Event)} only offers the event to the queue. Workers serialize it,
 * hand it to the {@link EventSender} and classify the answer:
 * <ul>
 *   <li>2xx: {@link DeliveryOutcome#SENT};</li>
 *   <li>429: the {@link RateLimiter} learns a cooldown and the event is dropped;</li>
 *   <li>other 4xx: dropped, resending cannot succeed;</li>
 *   <li>5xx or I/O error: retried after a {@link RetryPolicy} delay until
 *       {@code maxAttempts} attempts have failed.</li>
 * </ul>
 * Events of a category that is cooling down are dropped without a network call.
 *
 * <p>Every accepted event is counted by an {@link InFlightTracker} until it reaches a
 * terminal outcome; {@link #flush(long)} waits on it. {@link #close()} stops intake and
 * returns at once: events already accepted are still delivered by the daemon workers, which
 * exit when the queue is empty.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see AsyncTransport.Builder
 */
public final class AsyncTransport implements Transport {
  private static final Logger logger = Logger.getLogger(AsyncTransport.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<Delivery> queue;
  private final ExecutorService workers;
  private final ScheduledThreadPoolExecutor retryScheduler;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean senderClosed = new AtomicBoolean(false);

  private final EventSender sender;
  private final EnvelopeSerializer serializer;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final RateLimiter rateLimiter;
  private final int maxAttempts;
  private final MetricsExporter metrics;

  private AsyncTransport(Builder builder) {
    this.sender = Objects.requireNonNull(builder.sender, "sender");
    this.serializer = builder.serializer != null ? builder.serializer : new EnvelopeSerializer();
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 30_000);
    this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : new RateLimiter();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    int workerCount = builder.workerCount;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);

    this.retryScheduler = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("faultline-retry-"));
    this.retryScheduler.setKeepAliveTime(1, TimeUnit.SECONDS);
    this.retryScheduler.allowCoreThreadTimeOut(true);
    this.retryScheduler.setRemoveOnCancelPolicy(true);

    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("faultline-transport-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: events stay queued (testing only)
      logger.warning("workerCount=0: no transport workers started; events will not be delivered");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("faultline-transport-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public CompletableFuture<DeliveryOutcome> sendEvent(Event event) {
    Objects.requireNonNull(event, "event");
    CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();
    if (!accepting.get()) {
      logger.fine("Transport closed; dropping event " + event.eventId());
      result.complete(DeliveryOutcome.DROPPED_CLOSED);
      return result;
    }
    DataCategory category = DataCategory.of(event);
    if (rateLimiter.isLimited(category)) {
      logger.fine("Category " + category.wireName() + " is rate limited; dropping event " + event.eventId());
      metrics.incrementRateLimited();
      result.complete(DeliveryOutcome.DROPPED_RATE_LIMITED);
      return result;
    }
    Delivery delivery = new Delivery(event, category, result);
    inFlightTracker.begin(event.eventId());
    if (!queue.offer(delivery)) {
      inFlightTracker.end(event.eventId());
      metrics.incrementQueueFull();
      logger.warning("Transport queue full; dropping event " + event.eventId());
      result.complete(DeliveryOutcome.DROPPED_QUEUE_FULL);
      return result;
    }
    metrics.incrementEnqueued();
    metrics.recordQueueDepth(queue.size());
    return result;
  }

  @Override
  public boolean flush(long timeoutMs) {
    try {
      return inFlightTracker.awaitDrained(timeoutMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public int queueDepth() {
    return queue.size();
  }

  public int pending() {
    return inFlightTracker.pending();
  }

  public RateLimiter rateLimiter() {
    return rateLimiter;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        Delivery delivery = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (delivery == null) {
          if (!running.get()) break;
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        process(delivery);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Transport loop error", t);
      }
    }
  }

  private void process(Delivery delivery) {
    try {
      delivery.envelope = serializer.serialize(delivery.event);
    } catch (EnvelopeSerializationException e) {
      logger.log(Level.WARNING, "Dropping event " + delivery.eventId() + " that cannot be serialized", e);
      metrics.incrementDropped();
      finish(delivery, DeliveryOutcome.DROPPED_SERIALIZATION);
      return;
    }
    try {
      attempt(delivery);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Delivery of event " + delivery.eventId() + " failed", e);
      metrics.incrementDropped();
      finish(delivery, DeliveryOutcome.DROPPED_RETRIES_EXHAUSTED);
    }
  }

  private void attempt(Delivery delivery) {
    if (rateLimiter.isLimited(delivery.category)) {
      metrics.incrementRateLimited();
      finish(delivery, DeliveryOutcome.DROPPED_RATE_LIMITED);
      return;
    }
    SendResponse response;
    try {
      response = sender.send(delivery.event, delivery.envelope);
    } catch (IOException | RuntimeException e) {
      retryOrGiveUp(delivery, e.toString(), e);
      return;
    }
    rateLimiter.update(response);
    if (response.isSuccess()) {
      metrics.incrementSent();
      finish(delivery, DeliveryOutcome.SENT);
    } else if (response.isRateLimited()) {
      logger.warning("Collector rate limited event " + delivery.eventId() + "; dropping it");
      metrics.incrementRateLimited();
      finish(delivery, DeliveryOutcome.DROPPED_RATE_LIMITED);
    } else if (response.isServerError()) {
      retryOrGiveUp(delivery, "HTTP " + response.statusCode(), null);
    } else {
      logger.warning("Collector rejected event " + delivery.eventId() + " with HTTP " + response.statusCode());
      metrics.incrementDropped();
      finish(delivery, DeliveryOutcome.DROPPED_CLIENT_ERROR);
    }
  }

  private void retryOrGiveUp(Delivery delivery, String reason, Exception failure) {
    int failedAttempts = delivery.failedAttempts + 1;
    if (failedAttempts >= maxAttempts) {
      logger.log(Level.WARNING, "Dropping event " + delivery.eventId() + " after "
          + failedAttempts + " failed attempts: " + reason, failure);
      metrics.incrementDropped();
      finish(delivery, DeliveryOutcome.DROPPED_RETRIES_EXHAUSTED);
      return;
    }
    delivery.failedAttempts = failedAttempts;
    long delayMs = retryPolicy.computeDelayMs(failedAttempts);
    logger.fine("Retrying event " + delivery.eventId() + " in " + delayMs + " ms: " + reason);
    metrics.incrementRetried();
    retryScheduler.schedule(() -> retry(delivery), delayMs, TimeUnit.MILLISECONDS);
  }

  private void retry(Delivery delivery) {
    try {
      attempt(delivery);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry of event " + delivery.eventId() + " failed", t);
      metrics.incrementDropped();
      finish(delivery, DeliveryOutcome.DROPPED_RETRIES_EXHAUSTED);
    }
  }

  private void finish(Delivery delivery, DeliveryOutcome outcome) {
    if (!delivery.finished.compareAndSet(false, true)) {
      return;
    }
    inFlightTracker.end(delivery.eventId());
    if (!accepting.get() && inFlightTracker.pending() == 0) {
      closeSender();
    }
    delivery.result.complete(outcome);
  }

  private void closeSender() {
    if (senderClosed.compareAndSet(false, true)) {
      try {
        sender.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close event sender", e);
      }
    }
  }

  /**
   * Stops accepting events and returns without waiting. Queued and retrying events are still
   * delivered; the sender is closed once the last of them finishes. Call {@link #flush(long)}
   * first to wait for them.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    running.set(false);
    workers.shutdown();
    if (inFlightTracker.pending() == 0) {
      closeSender();
    }
  }

  public boolean isClosed() {
    return !accepting.get();
  }

  private static final class Delivery {
    final Event event;
    final DataCategory category;
    final CompletableFuture<DeliveryOutcome> result;
    final AtomicBoolean finished = new AtomicBoolean();
    String envelope;
    int failedAttempts;

    Delivery(Event event, DataCategory category, CompletableFuture<DeliveryOutcome> result) {
      this.event = event;
      this.category = category;
      this.result = result;
    }

    String eventId() {
      return event.eventId();
    }
  }

  /** Builder for {@link AsyncTransport}. */
  public static final class Builder {
    private EventSender sender;
    private EnvelopeSerializer serializer;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private RateLimiter rateLimiter;
    private int maxAttempts = 3;
    private int workerCount = 1;
    private int queueCapacity = 100;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the sender performing each delivery attempt.
     *
     * <p><b>Required.</b>
     *
     * @param sender the sender
     * @return this builder
     */
    public Builder sender(EventSender sender) {
      this.sender = sender;
      return this;
    }

    /**
     * Sets the envelope serializer.
     *
     * <p>Optional. Defaults to an {@link EnvelopeSerializer} over the default JSON codec.
     *
     * @param serializer the serializer
     * @return this builder
     */
    public Builder serializer(EnvelopeSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    /**
     * Sets the tracker counting accepted but unfinished events.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the retry policy that computes the delay between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=200} and {@code maxDelayMs=30000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the rate limiter holding per-category cooldowns.
     *
     * <p>Optional. Defaults to a {@link RateLimiter} on the system clock.
     *
     * @param rateLimiter the rate limiter
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets the number of attempts per event before it is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per event
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of worker threads draining the queue.
     *
     * <p>Optional. Defaults to {@code 1}. Must be &ge; 0; {@code 0} disables delivery
     * (useful for testing only).
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the delivery queue.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the transport and starts its workers.
     *
     * @return a new {@link AsyncTransport}
     * @throws NullPointerException if {@code sender} is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}, {@code workerCount < 0}
     *     or {@code queueCapacity <= 0}
     */
    public AsyncTransport build() {
      return new AsyncTransport(this);
    }
  }
}
