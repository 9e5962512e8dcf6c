/**
 * Micrometer bridge for exporting inbox metrics to Prometheus, Grafana, and other backends.
 *
 * @see inbox.micrometer.MicrometerMetricsExporter
 */
package inbox.micrometer;
