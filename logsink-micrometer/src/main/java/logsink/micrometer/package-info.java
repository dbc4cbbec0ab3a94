/**
 * Micrometer bridge for exporting logsink metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link logsink.micrometer.MicrometerMetricsExporter} implements the
 * {@link logsink.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see logsink.micrometer.MicrometerMetricsExporter
 */
package logsink.micrometer;
