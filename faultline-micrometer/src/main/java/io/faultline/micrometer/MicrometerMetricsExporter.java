package io.faultline.micrometer;

import io.faultline.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code faultline.transport.enqueued}: events accepted into the delivery queue</li>
 *   <li>{@code faultline.transport.queue.full}: events rejected, queue full</li>
 *   <li>{@code faultline.transport.sent}: events the collector accepted</li>
 *   <li>{@code faultline.transport.retried}: failed attempts scheduled for another try</li>
 *   <li>{@code faultline.transport.dropped}: events given up on after queueing</li>
 *   <li>{@code faultline.transport.rate.limited}: events dropped by rate limits</li>
 *   <li>{@code faultline.capture.dropped}: events discarded before the transport, tagged
 *       with {@code reason}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code faultline.transport.queue.depth}: current delivery queue depth</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter enqueued;
  private final Counter queueFull;
  private final Counter sent;
  private final Counter retried;
  private final Counter dropped;
  private final Counter rateLimited;
  private final Gauge queueDepthGauge;
  private final Map<String, Counter> droppedBeforeTransport = new ConcurrentHashMap<>();

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "faultline"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "faultline");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for processes running several
   * clients.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.faultline"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.enqueued = Counter.builder(namePrefix + ".transport.enqueued")
        .description("Events accepted into the delivery queue")
        .register(registry);
    this.queueFull = Counter.builder(namePrefix + ".transport.queue.full")
        .description("Events rejected because the delivery queue was full")
        .register(registry);
    this.sent = Counter.builder(namePrefix + ".transport.sent")
        .description("Events accepted by the collector")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".transport.retried")
        .description("Failed delivery attempts scheduled for retry")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".transport.dropped")
        .description("Events dropped after client errors, exhausted retries or serialization failures")
        .register(registry);
    this.rateLimited = Counter.builder(namePrefix + ".transport.rate.limited")
        .description("Events dropped because their category was rate limited")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".transport.queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementQueueFull() {
    if (closed) return;
    queueFull.increment();
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void incrementDroppedBeforeTransport(String reason) {
    if (closed) return;
    droppedBeforeTransport.computeIfAbsent(reason, r -> Counter.builder(namePrefix + ".capture.dropped")
        .description("Events discarded before reaching the transport")
        .tag("reason", r)
        .register(registry)).increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    this.queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the client is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, queueFull, sent, retried, dropped,
        rateLimited, queueDepthGauge));
    meters.addAll(droppedBeforeTransport.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
