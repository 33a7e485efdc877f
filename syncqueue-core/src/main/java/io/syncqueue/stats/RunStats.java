package io.syncqueue.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory run statistics: cumulative counters, a bounded ring of recent errors and
 * rolling processing-time samples.
 *
 * <p>Created when the engine initializes and never persisted; counters reset on restart.
 * Recording methods never throw. This class is thread-safe.
 */
public final class RunStats {
  public static final int ERROR_CAPACITY = 100;
  public static final int SAMPLE_CAPACITY = 1000;
  private static final int RECENT_ERRORS = 5;

  private final Clock clock;

  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private final AtomicLong batchesProcessed = new AtomicLong();

  private final ArrayDeque<ErrorRecord> errors = new ArrayDeque<>(ERROR_CAPACITY);
  private final ArrayDeque<Long> processingTimes = new ArrayDeque<>(SAMPLE_CAPACITY);
  private long processingTimeSum;

  private double averageBatchSize;
  private double eventsPerSecond;

  private volatile Instant startedAt;
  private volatile Instant lastProcessedAt;

  public RunStats(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void markStarted() {
    startedAt = clock.instant();
  }

  public void recordProcessed(long durationMs) {
    processed.incrementAndGet();
    synchronized (processingTimes) {
      if (processingTimes.size() == SAMPLE_CAPACITY) {
        processingTimeSum -= processingTimes.removeFirst();
      }
      long sample = Math.max(0L, durationMs);
      processingTimes.addLast(sample);
      processingTimeSum += sample;
    }
  }

  public void recordRetried() {
    retried.incrementAndGet();
  }

  public void recordDeadLettered() {
    deadLettered.incrementAndGet();
  }

  /**
   * Counts one completed batch and folds its size into the running average.
   */
  public synchronized void recordBatch(int size) {
    long n = batchesProcessed.incrementAndGet();
    averageBatchSize = (averageBatchSize * (n - 1) + size) / n;
  }

  /**
   * Folds one tick's throughput into the moving events-per-second average.
   */
  public synchronized void recordTick(int eventsProcessed, long elapsedMs) {
    lastProcessedAt = clock.instant();
    double rate = eventsProcessed * 1000.0 / Math.max(1L, elapsedMs);
    eventsPerSecond = (eventsPerSecond + rate) / 2;
  }

  /**
   * Appends an error to the ring, evicting the oldest beyond {@link #ERROR_CAPACITY},
   * and increments {@code failed}.
   */
  public ErrorRecord recordError(String type, String message, String eventId, Throwable cause) {
    ErrorRecord record = new ErrorRecord(
        type,
        message != null ? message : (cause != null ? String.valueOf(cause) : "unknown"),
        eventId,
        cause == null ? null : cause.getClass().getName(),
        clock.instant());
    synchronized (errors) {
      if (errors.size() == ERROR_CAPACITY) {
        errors.removeFirst();
      }
      errors.addLast(record);
    }
    failed.incrementAndGet();
    return record;
  }

  public long processed() {
    return processed.get();
  }

  public long failed() {
    return failed.get();
  }

  public long retried() {
    return retried.get();
  }

  public long deadLettered() {
    return deadLettered.get();
  }

  public long batchesProcessed() {
    return batchesProcessed.get();
  }

  public List<ErrorRecord> errors() {
    synchronized (errors) {
      return List.copyOf(errors);
    }
  }

  public StatsSnapshot snapshot() {
    double averageProcessingTime;
    int samples;
    synchronized (processingTimes) {
      samples = processingTimes.size();
      averageProcessingTime = samples == 0 ? 0.0 : (double) processingTimeSum / samples;
    }
    List<ErrorRecord> recent = new ArrayList<>(RECENT_ERRORS);
    synchronized (errors) {
      Iterator<ErrorRecord> it = errors.descendingIterator();
      while (it.hasNext() && recent.size() < RECENT_ERRORS) {
        recent.add(0, it.next());
      }
    }
    double batchAverage;
    double rate;
    synchronized (this) {
      batchAverage = averageBatchSize;
      rate = eventsPerSecond;
    }
    Instant started = startedAt;
    long uptime = started == null ? 0L
        : Math.max(0L, Duration.between(started, clock.instant()).getSeconds());
    return new StatsSnapshot(
        processed.get(),
        failed.get(),
        retried.get(),
        deadLettered.get(),
        batchesProcessed.get(),
        averageProcessingTime,
        rate,
        batchAverage,
        samples,
        started,
        lastProcessedAt,
        uptime,
        recent);
  }
}
