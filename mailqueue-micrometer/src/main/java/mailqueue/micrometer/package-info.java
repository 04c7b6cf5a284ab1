/**
 * Micrometer bridge for exporting mail queue metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link mailqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link mailqueue.spi.MetricsExporter} SPI using Micrometer counters, gauges and summaries.
 *
 * @see mailqueue.micrometer.MicrometerMetricsExporter
 */
package mailqueue.micrometer;
