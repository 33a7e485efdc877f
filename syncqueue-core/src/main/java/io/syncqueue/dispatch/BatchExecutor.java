package io.syncqueue.dispatch;

import io.syncqueue.QueueListener;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.Priority;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a fetched page of events with bounded concurrency.
 *
 * <p>With batching enabled, the page is split into batches of at most
 * {@code maxBatchSize}, each batch is grouped by {@link SyncEvent#tableName()} and every
 * group is chunked into slices of at most {@code maxConcurrentWorkers}. A chunk's workers
 * run concurrently and the whole chunk finishes before the next one starts. Otherwise
 * events run one at a time on the calling thread until the worker cap is reached.
 */
public final class BatchExecutor {
  private static final Logger logger = Logger.getLogger(BatchExecutor.class.getName());

  private final EventWorker worker;
  private final QueueConfig config;
  private final InFlightTracker inFlightTracker;
  private final RunStats stats;
  private final MetricsExporter metrics;
  private final QueueListener listener;
  private final ErrorRecorder errors;
  private final ExecutorService workerExecutor;
  private final AtomicLong batchSequence = new AtomicLong();

  public BatchExecutor(EventWorker worker, QueueConfig config, InFlightTracker inFlightTracker,
      RunStats stats, MetricsExporter metrics, QueueListener listener, ErrorRecorder errors,
      ExecutorService workerExecutor) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.config = Objects.requireNonNull(config, "config");
    this.inFlightTracker = Objects.requireNonNull(inFlightTracker, "inFlightTracker");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
  }

  /**
   * Executes the page and returns the number of events that completed successfully.
   */
  public int execute(List<SyncEvent> events, Priority priority) {
    if (events.isEmpty()) {
      return 0;
    }
    if (!config.batching().enabled() || events.size() == 1) {
      return executeIndividually(events);
    }
    int processed = 0;
    for (List<SyncEvent> batch : chunk(events, config.batching().maxBatchSize())) {
      processed += executeBatch(batch, priority);
    }
    return processed;
  }

  private int executeIndividually(List<SyncEvent> events) {
    int processed = 0;
    for (int i = 0; i < events.size(); i++) {
      if (inFlightTracker.activeCount() >= config.maxConcurrentWorkers()) {
        List<SyncEvent> unrun = events.subList(i, events.size());
        logger.log(Level.FINE, "Worker cap reached, releasing {0} claimed events", unrun.size());
        unrun.forEach(worker::release);
        break;
      }
      if (worker.run(events.get(i))) {
        processed++;
      }
    }
    return processed;
  }

  private int executeBatch(List<SyncEvent> batch, Priority priority) {
    String batchId = "batch_" + priority.wireName() + "_" + batchSequence.incrementAndGet();
    long startNanos = System.nanoTime();
    logger.log(Level.FINE, "Processing batch {0} with {1} events",
        new Object[]{batchId, batch.size()});

    int processed = 0;
    try {
      for (Map.Entry<String, List<SyncEvent>> group : groupByTable(batch).entrySet()) {
        processed += executeGroup(group.getValue());
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Batch " + batchId + " failed", e);
      errors.record("batch_processing", e);
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    stats.recordBatch(batch.size());
    metrics.incrementBatches();
    logger.log(Level.INFO, "Batch {0} completed: {1}/{2} processed ({3} ms)",
        new Object[]{batchId, processed, batch.size(), elapsedMs});
    listener.onBatchProcessed(new BatchSummary(batchId, priority, batch.size(), processed, elapsedMs));
    return processed;
  }

  private int executeGroup(List<SyncEvent> group) {
    int processed = 0;
    int chunkSize = Math.min(config.maxConcurrentWorkers(), group.size());
    for (List<SyncEvent> slice : chunk(group, chunkSize)) {
      List<CompletableFuture<Boolean>> running = new ArrayList<>(slice.size());
      for (SyncEvent event : slice) {
        try {
          running.add(CompletableFuture.supplyAsync(() -> worker.run(event), workerExecutor));
        } catch (RejectedExecutionException e) {
          logger.log(Level.WARNING, "Worker executor rejected eventId=" + event.id(), e);
          worker.release(event);
        }
      }
      for (CompletableFuture<Boolean> future : running) {
        try {
          if (future.join()) {
            processed++;
          }
        } catch (CompletionException e) {
          logger.log(Level.SEVERE, "Worker terminated abnormally", e.getCause());
        }
      }
    }
    return processed;
  }

  static Map<String, List<SyncEvent>> groupByTable(List<SyncEvent> events) {
    Map<String, List<SyncEvent>> groups = new LinkedHashMap<>();
    for (SyncEvent event : events) {
      String table = event.tableName() == null ? "" : event.tableName();
      groups.computeIfAbsent(table, k -> new ArrayList<>()).add(event);
    }
    return groups;
  }

  static <T> List<List<T>> chunk(List<T> items, int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("chunk size must be > 0, got: " + size);
    }
    List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
    for (int i = 0; i < items.size(); i += size) {
      chunks.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
    }
    return chunks;
  }
}
