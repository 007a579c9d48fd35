/**
 * Micrometer bridge for exporting bus metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link cable.micrometer.MicrometerMetricsExporter} implements the
 * {@link cable.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package cable.micrometer;
