package io.syncqueue.jdbc;

import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import io.syncqueue.model.SyncEvent;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL event store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim; concurrent claimers skip each other's rows instead of waiting on them.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {

  public PostgresEventStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public PostgresEventStore(ConnectionProvider connectionProvider, String tableName,
      Duration lockTimeout, Clock clock) {
    super(connectionProvider, tableName, lockTimeout, clock);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  protected List<SyncEvent> claim(Connection conn, String claimToken, Priority priority,
      int limit, int maxRetryCount, Instant now, Instant lockExpiry) {
    String sql = "UPDATE " + tableName() + " SET status='" + EventStatus.PROCESSING.wireName() + "'" +
        ", locked_by=?, locked_at=?, updated_at=?" +
        " WHERE id IN (SELECT id FROM " + tableName() + " WHERE " + CLAIMABLE + CLAIM_ORDER +
        " LIMIT ? FOR UPDATE SKIP LOCKED) RETURNING " + COLUMNS;
    List<SyncEvent> claimed = JdbcTemplate.updateReturning(conn, sql, EVENT_ROW_MAPPER,
        claimToken, now, now,
        priority, maxRetryCount, now, lockExpiry, limit);
    return inScheduleOrder(claimed);
  }
}
