/**
 * Micrometer bridge for exporting sync-queue metrics to Prometheus, Grafana and other backends.
 *
 * @see io.syncqueue.micrometer.MicrometerMetricsExporter
 */
package io.syncqueue.micrometer;
