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
 * MySQL event store. Also compatible with TiDB.
 *
 * <p>Uses {@code UPDATE ... ORDER BY ... LIMIT} for the claim phase and
 * {@code DELETE ... ORDER BY ... LIMIT} for purging, since MySQL rejects {@code LIMIT}
 * inside {@code IN} subqueries.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {

  public MySqlEventStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public MySqlEventStore(ConnectionProvider connectionProvider, String tableName,
      Duration lockTimeout, Clock clock) {
    super(connectionProvider, tableName, lockTimeout, clock);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  protected List<SyncEvent> claim(Connection conn, String claimToken, Priority priority,
      int limit, int maxRetryCount, Instant now, Instant lockExpiry) {
    String claimSql = "UPDATE " + tableName() + " SET status='" + EventStatus.PROCESSING.wireName() + "'" +
        ", locked_by=?, locked_at=?, updated_at=?" +
        " WHERE " + CLAIMABLE + CLAIM_ORDER + " LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql,
        claimToken, now, now,
        priority, maxRetryCount, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, claimToken);
  }

  @Override
  protected int purgeBatch(Connection conn, EventStatus status, Instant cutoff, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE status=? AND updated_at<?" +
        " ORDER BY updated_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, status, cutoff, limit);
  }
}
