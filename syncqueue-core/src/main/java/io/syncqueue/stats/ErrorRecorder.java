package io.syncqueue.stats;

import io.syncqueue.QueueListener;
import io.syncqueue.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records an error in {@link RunStats}, counts it and notifies listeners.
 *
 * <p>Never throws: recording must not block or break the dispatch loop.
 */
public final class ErrorRecorder {
  private static final Logger logger = Logger.getLogger(ErrorRecorder.class.getName());

  private final RunStats stats;
  private final MetricsExporter metrics;
  private final QueueListener listener;

  public ErrorRecorder(RunStats stats, MetricsExporter metrics, QueueListener listener) {
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public void record(String type, String message, String eventId, Throwable cause) {
    try {
      ErrorRecord record = stats.recordError(type, message, eventId, cause);
      metrics.incrementFailed();
      listener.onError(record);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record " + type + " error", e);
    }
  }

  public void record(String type, Throwable cause) {
    record(type, cause == null ? null : cause.getMessage(), null, cause);
  }
}
