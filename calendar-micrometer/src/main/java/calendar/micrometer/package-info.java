/**
 * Micrometer bridge for exporting federation metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link calendar.micrometer.MicrometerMetricsExporter} implements the
 * {@link calendar.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see calendar.micrometer.MicrometerMetricsExporter
 */
package calendar.micrometer;
