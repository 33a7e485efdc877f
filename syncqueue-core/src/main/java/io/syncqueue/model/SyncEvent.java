package io.syncqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of one queued unit of work, as returned by
 * {@link io.syncqueue.spi.EventStore#fetchPendingByPriority}.
 *
 * <p>{@code payloadJson} is opaque to the engine and only interpreted by the
 * {@link io.syncqueue.spi.EventProcessor}. {@code tableName} is the logical target
 * used to group a fetched page for locality.
 */
public record SyncEvent(
    String id,
    String tableName,
    String payloadJson,
    Priority priority,
    EventStatus status,
    int retryCount,
    String lastError,
    Instant scheduledAt,
    Instant createdAt,
    Instant updatedAt
) {

  public SyncEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(status, "status");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
  }

  /**
   * Creates a new pending event due now. Convenience for producers and tests.
   */
  public static SyncEvent pending(String id, String tableName, String payloadJson, Priority priority) {
    Instant now = Instant.now();
    return new SyncEvent(id, tableName, payloadJson, priority, EventStatus.PENDING,
        0, null, now, now, now);
  }
}
