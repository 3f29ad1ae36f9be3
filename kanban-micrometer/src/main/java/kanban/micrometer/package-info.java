/**
 * Micrometer bridge for exporting engine metrics to Prometheus, Grafana and other backends.
 *
 * @see kanban.micrometer.MicrometerMetricsExporter
 */
package kanban.micrometer;
