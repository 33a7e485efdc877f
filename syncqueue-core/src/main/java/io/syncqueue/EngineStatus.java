package io.syncqueue;

import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.Priority;
import io.syncqueue.stats.StatsSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot returned by {@link SyncQueueEngine#getStatus()}.
 *
 * @param initialized       whether {@link SyncQueueEngine#initialize} succeeded
 * @param processing        whether the tick loop is running
 * @param activeWorkers     workers currently running across all priorities
 * @param maxWorkers        configured worker cap
 * @param config            active configuration, {@code null} before initialization
 * @param stats             run statistics with the most recent errors
 * @param rateLimiterTokens tokens currently available to the dispatcher
 * @param workerPools       per-priority occupancy
 */
public record EngineStatus(
    boolean initialized,
    boolean processing,
    int activeWorkers,
    int maxWorkers,
    QueueConfig config,
    StatsSnapshot stats,
    double rateLimiterTokens,
    Map<Priority, WorkerPoolStatus> workerPools
) {

  public EngineStatus {
    workerPools = workerPools.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(workerPools));
  }
}
