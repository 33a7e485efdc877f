package io.syncqueue.stats;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of {@link RunStats}.
 */
public record StatsSnapshot(
    long processed,
    long failed,
    long retried,
    long deadLettered,
    long batchesProcessed,
    double averageProcessingTimeMs,
    double eventsPerSecond,
    double averageBatchSize,
    int processingTimeSamples,
    Instant startedAt,
    Instant lastProcessedAt,
    long uptimeSeconds,
    List<ErrorRecord> recentErrors
) {

  public StatsSnapshot {
    recentErrors = List.copyOf(recentErrors);
  }
}
