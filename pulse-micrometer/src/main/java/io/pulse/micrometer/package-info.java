/**
 * Micrometer bridge for exporting retry metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.pulse.micrometer.MicrometerRetryMetrics} implements the
 * {@link io.pulse.spi.RetryMetrics} SPI using Micrometer counters and a distribution summary.
 *
 * @see io.pulse.micrometer.MicrometerRetryMetrics
 */
package io.pulse.micrometer;
