/**
 * Micrometer bridge for exporting faultline transport metrics to Prometheus, Grafana, and
 * other backends.
 *
 * <p>{@link io.faultline.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.faultline.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see io.faultline.micrometer.MicrometerMetricsExporter
 */
package io.faultline.micrometer;
