/**
 * Service provider interfaces for plugging backends into the client.
 *
 * @see io.faultline.spi.MetricsExporter
 */
package io.faultline.spi;
