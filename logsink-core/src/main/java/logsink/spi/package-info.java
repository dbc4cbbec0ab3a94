/**
 * Service provider interfaces for plugging observability into the worker.
 *
 * @see logsink.spi.MetricsExporter
 */
package logsink.spi;
