/**
 * Service provider interfaces for plugging in persistence, per-event business logic
 * and metrics.
 *
 * @see io.syncqueue.spi.EventStore
 * @see io.syncqueue.spi.EventProcessor
 * @see io.syncqueue.spi.MetricsExporter
 */
package io.syncqueue.spi;
