package io.syncqueue.jdbc;

import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static JDBC helpers shared by the event store dialects.
 *
 * <p>Parameters may be passed as {@link Instant}, {@link EventStatus} or {@link Priority}
 * and are bound as a timestamp or the wire name respectively. Every {@link SQLException} is
 * rethrown as {@link EventStoreException} tagged with the failing operation.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** INSERT, UPDATE or DELETE; returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new EventStoreException("update failed: " + e.getMessage(), e);
    }
  }

  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return collect(conn, "query", sql, mapper, params);
  }

  /** First mapped row, if any. */
  public static <T> Optional<T> queryForOptional(Connection conn, String sql, RowMapper<T> mapper,
      Object... params) {
    List<T> rows = collect(conn, "query", sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /**
   * Runs a {@code SELECT key, COUNT(*) AS n ... GROUP BY key} query and returns the counts
   * keyed by the raw column value, in result order.
   */
  public static Map<String, Long> queryForCounts(Connection conn, String sql, String keyColumn,
      Object... params) {
    Map<String, Long> counts = new LinkedHashMap<>();
    collect(conn, "count", sql, rs -> counts.put(rs.getString(keyColumn), rs.getLong("n")), params);
    return counts;
  }

  /** UPDATE ... RETURNING (PostgreSQL). */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return collect(conn, "update returning", sql, mapper, params);
  }

  private static <T> List<T> collect(Connection conn, String operation, String sql, RowMapper<T> mapper,
      Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
      return rows;
    } catch (SQLException e) {
      throw new EventStoreException(operation + " failed: " + e.getMessage(), e);
    }
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param == null) {
      ps.setObject(index, null);
    } else if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof EventStatus status) {
      ps.setString(index, status.wireName());
    } else if (param instanceof Priority priority) {
      ps.setString(index, priority.wireName());
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else {
      ps.setObject(index, param);
    }
  }

  private JdbcTemplate() {}
}
